package dk.cloudcreate.eventsourcing.common.transaction;

import dk.cloudcreate.essentials.shared.functional.*;
import org.slf4j.*;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * This interface creates a {@link UnitOfWork}
 *
 * @param <UOW> the {@link UnitOfWork} sub-type returned by the {@link UnitOfWorkFactory}
 */
public interface UnitOfWorkFactory<UOW extends UnitOfWork> {
    Logger unitOfWorkLog = LoggerFactory.getLogger(UnitOfWorkFactory.class);

    /**
     * Get a required active {@link UnitOfWork}
     *
     * @return the active {@link UnitOfWork}
     * @throws NoActiveUnitOfWorkException if the is no active {@link UnitOfWork}
     */
    UOW getRequiredUnitOfWork();

    /**
     * Get the current {@link UnitOfWork} or create a new {@link UnitOfWork}
     * if one is missing
     *
     * @return a {@link UnitOfWork}
     */
    UOW getOrCreateNewUnitOfWork();

    Optional<UOW> getCurrentUnitOfWork();

    /**
     * Run <code>unitOfWorkConsumer</code> within a {@link UnitOfWork}. If no {@link UnitOfWork} is active, a new one is created
     * and committed (or rolled back in case of an exception) when the consumer returns.
     * If a {@link UnitOfWork} is already active the consumer joins it and an exception only marks it as rollback-only.<br>
     * {@link RuntimeException}'s are rethrown as-is, checked exceptions are wrapped in a {@link UnitOfWorkException}
     */
    default void usingUnitOfWork(CheckedConsumer<UOW> unitOfWorkConsumer) {
        requireNonNull(unitOfWorkConsumer, "No unitOfWorkConsumer provided");
        withUnitOfWork(unitOfWork -> {
            unitOfWorkConsumer.accept(unitOfWork);
            return null;
        });
    }

    /**
     * Same as {@link #usingUnitOfWork(CheckedConsumer)} but returns the result of the <code>unitOfWorkFunction</code>
     */
    default <R> R withUnitOfWork(CheckedFunction<UOW, R> unitOfWorkFunction) {
        requireNonNull(unitOfWorkFunction, "No unitOfWorkFunction provided");
        var existingUnitOfWork = getCurrentUnitOfWork();
        var unitOfWork = existingUnitOfWork.orElseGet(() -> {
            unitOfWorkLog.trace("Creating a new UnitOfWork as there wasn't an existing UnitOfWork");
            return getOrCreateNewUnitOfWork();
        });
        existingUnitOfWork.ifPresent(uow -> unitOfWorkLog.trace("NestedUnitOfWork: Reusing existing UnitOfWork"));
        try {
            var result = unitOfWorkFunction.apply(unitOfWork);
            if (existingUnitOfWork.isEmpty()) {
                if (unitOfWork.status() == UnitOfWorkStatus.MarkedForRollbackOnly) {
                    unitOfWorkLog.debug("Rolling back the UnitOfWork as it was marked as rollback only");
                    unitOfWork.rollback();
                } else {
                    unitOfWorkLog.trace("Committing the UnitOfWork");
                    unitOfWork.commit();
                }
            }
            return result;
        } catch (Exception e) {
            if (existingUnitOfWork.isEmpty()) {
                unitOfWorkLog.debug("Rolling back the UnitOfWork due to {}", e.getClass().getSimpleName());
                unitOfWork.rollback(e);
            } else {
                unitOfWorkLog.debug("NestedUnitOfWork: Marking UnitOfWork as rollback only due to {}", e.getClass().getSimpleName());
                unitOfWork.markAsRollbackOnly(e);
            }
            if (e instanceof RuntimeException) {
                throw (RuntimeException) e;
            }
            throw new UnitOfWorkException(e);
        }
    }
}
