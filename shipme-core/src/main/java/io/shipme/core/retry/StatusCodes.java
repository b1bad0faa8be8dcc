package io.shipme.core.retry;

import io.shipme.core.tool.ValidationException;
import java.util.OptionalInt;

public final class StatusCodes {
    private StatusCodes() {
    }

    /**
     * Status code carried by a failure. Empty means a network-level fault.
     */
    public static OptionalInt of(Throwable failure) {
        if (failure instanceof ApiException api) {
            return OptionalInt.of(api.status());
        }
        if (failure instanceof ValidationException validation) {
            return OptionalInt.of(validation.status());
        }
        return OptionalInt.empty();
    }
}
