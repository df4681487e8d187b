package dk.cloudcreate.eventsourcing.common.transaction;

public class NoActiveUnitOfWorkException extends UnitOfWorkException {
    public NoActiveUnitOfWorkException() {
        super("No active UnitOfWork");
    }

    public NoActiveUnitOfWorkException(String message) {
        super(message);
    }
}
