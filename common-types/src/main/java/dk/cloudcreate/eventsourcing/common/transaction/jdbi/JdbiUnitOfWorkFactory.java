package dk.cloudcreate.eventsourcing.common.transaction.jdbi;

import dk.cloudcreate.eventsourcing.common.transaction.*;
import org.jdbi.v3.core.*;
import org.slf4j.*;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * {@link HandleAwareUnitOfWorkFactory} where each {@link UnitOfWork} owns a Jdbi {@link Handle} with an open database transaction.<br>
 * The active {@link UnitOfWork} is bound to the current thread until it's committed or rolled back.
 */
public class JdbiUnitOfWorkFactory implements HandleAwareUnitOfWorkFactory<HandleAwareUnitOfWork> {
    private static final Logger log = LoggerFactory.getLogger(JdbiUnitOfWorkFactory.class);

    private final Jdbi                              jdbi;
    private final ThreadLocal<JdbiUnitOfWork> unitOfWorks = new ThreadLocal<>();

    public JdbiUnitOfWorkFactory(Jdbi jdbi) {
        this.jdbi = requireNonNull(jdbi, "No jdbi instance provided");
    }

    public Jdbi getJdbi() {
        return jdbi;
    }

    @Override
    public HandleAwareUnitOfWork getRequiredUnitOfWork() {
        var unitOfWork = unitOfWorks.get();
        if (unitOfWork == null) {
            throw new NoActiveUnitOfWorkException();
        }
        return unitOfWork;
    }

    @Override
    public HandleAwareUnitOfWork getOrCreateNewUnitOfWork() {
        var unitOfWork = unitOfWorks.get();
        if (unitOfWork == null) {
            log.trace("Creating new UnitOfWork");
            unitOfWork = new JdbiUnitOfWork(this);
            unitOfWork.start();
            unitOfWorks.set(unitOfWork);
        }
        return unitOfWork;
    }

    @Override
    public Optional<HandleAwareUnitOfWork> getCurrentUnitOfWork() {
        return Optional.ofNullable(unitOfWorks.get());
    }

    private void removeUnitOfWork() {
        unitOfWorks.remove();
    }

    private static class JdbiUnitOfWork implements HandleAwareUnitOfWork {
        private final JdbiUnitOfWorkFactory unitOfWorkFactory;
        private       Handle                handle;
        private       UnitOfWorkStatus      status;
        private       Exception             causeOfRollback;

        JdbiUnitOfWork(JdbiUnitOfWorkFactory unitOfWorkFactory) {
            this.unitOfWorkFactory = unitOfWorkFactory;
            status = UnitOfWorkStatus.Ready;
        }

        @Override
        public void start() {
            if (status == UnitOfWorkStatus.Ready || status.isCompleted()) {
                log.trace("Opening handle and beginning transaction");
                status = UnitOfWorkStatus.Started;
                try {
                    handle = unitOfWorkFactory.jdbi.open();
                    handle.begin();
                } catch (RuntimeException e) {
                    status = UnitOfWorkStatus.Ready;
                    if (handle != null) {
                        try {
                            handle.close();
                        } catch (RuntimeException closeException) {
                            e.addSuppressed(closeException);
                        } finally {
                            handle = null;
                        }
                    }
                    throw new UnitOfWorkException("Failed to start UnitOfWork", e);
                }
            } else {
                throw new UnitOfWorkException(msg("Cannot start an already started UnitOfWork with status {}", status));
            }
        }

        @Override
        public void commit() {
            if (status == UnitOfWorkStatus.Started) {
                try {
                    handle.commit();
                    status = UnitOfWorkStatus.Committed;
                    log.trace("Committed UnitOfWork");
                } catch (RuntimeException e) {
                    status = UnitOfWorkStatus.RolledBack;
                    causeOfRollback = e;
                    throw new UnitOfWorkException("Failed to commit UnitOfWork", e);
                } finally {
                    close();
                }
            } else if (status == UnitOfWorkStatus.MarkedForRollbackOnly) {
                rollback();
            } else {
                throw new UnitOfWorkException(msg("Cannot commit UnitOfWork as it has status {}", status));
            }
        }

        @Override
        public void rollback(Exception cause) {
            if (status == UnitOfWorkStatus.Started || status == UnitOfWorkStatus.MarkedForRollbackOnly) {
                causeOfRollback = cause != null ? cause : causeOfRollback;
                try {
                    handle.rollback();
                    log.trace("Rolled back UnitOfWork due to {}", causeOfRollback != null ? causeOfRollback.getMessage() : "manual rollback");
                } finally {
                    status = UnitOfWorkStatus.RolledBack;
                    close();
                }
            } else if (status.isCompleted()) {
                log.debug("Ignoring rollback of UnitOfWork with status {}", status);
            } else {
                throw new UnitOfWorkException(msg("Cannot rollback UnitOfWork as it has status {}", status));
            }
        }

        @Override
        public UnitOfWorkStatus status() {
            return status;
        }

        @Override
        public Exception getCauseOfRollback() {
            return causeOfRollback;
        }

        @Override
        public void markAsRollbackOnly(Exception cause) {
            if (status == UnitOfWorkStatus.Started || status == UnitOfWorkStatus.MarkedForRollbackOnly) {
                status = UnitOfWorkStatus.MarkedForRollbackOnly;
                causeOfRollback = cause;
            } else {
                throw new UnitOfWorkException(msg("Cannot mark UnitOfWork as rollback only as it has status {}", status));
            }
        }

        @Override
        public Handle handle() {
            if (handle == null || status.isCompleted()) {
                throw new UnitOfWorkException(msg("No active transaction, UnitOfWork has status {}", status));
            }
            return handle;
        }

        private void close() {
            try {
                handle.close();
            } finally {
                handle = null;
                unitOfWorkFactory.removeUnitOfWork();
            }
        }
    }
}
