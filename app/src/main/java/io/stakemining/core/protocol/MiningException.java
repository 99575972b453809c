package io.stakemining.core.protocol;

public class MiningException extends RuntimeException {
    private final MiningError error;

    public MiningException(MiningError error, String message) {
        super(message);
        this.error = error;
    }

    public MiningException(MiningError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public MiningError error() {
        return error;
    }

    public static MiningException alreadyMining(String caller) {
        return new MiningException(MiningError.ALREADY_MINING, "A mining session is already open for " + caller);
    }

    public static MiningException cannotReferSelf(String caller) {
        return new MiningException(MiningError.CANNOT_REFER_SELF, "Caller " + caller + " cannot refer itself");
    }

    public static MiningException sessionNotOpen(String caller) {
        return new MiningException(MiningError.SESSION_NOT_OPEN, "No open mining session for " + caller);
    }

    public static MiningException notAdministrator(String caller) {
        return new MiningException(MiningError.NOT_ADMINISTRATOR, caller + " is not the administrator");
    }

    public static MiningException closeNotAuthorized(String caller, String reason) {
        return new MiningException(MiningError.CLOSE_NOT_AUTHORIZED, "Close request for " + caller + " rejected: " + reason);
    }
}
