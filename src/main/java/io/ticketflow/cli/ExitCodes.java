package io.ticketflow.cli;

import io.ticketflow.error.BackgroundRunActiveException;
import io.ticketflow.error.ConfigException;
import io.ticketflow.error.StoreIOException;

public final class ExitCodes {
    public static final int OK = 0;
    public static final int NOT_FOUND = 1;
    public static final int STORE_INIT_FAILED = 2;
    public static final int BACKGROUND_RUN_ACTIVE = 3;
    public static final int ALREADY_EXISTS = 4;

    private ExitCodes() {
    }

    static int forException(Throwable error) {
        if (error instanceof BackgroundRunActiveException) {
            return BACKGROUND_RUN_ACTIVE;
        }
        if (error instanceof StoreIOException || error instanceof ConfigException) {
            return STORE_INIT_FAILED;
        }
        return NOT_FOUND;
    }
}
