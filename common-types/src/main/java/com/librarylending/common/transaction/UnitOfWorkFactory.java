package com.librarylending.common.transaction;

import dk.cloudcreate.essentials.shared.functional.*;
import org.slf4j.*;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Creates and tracks the {@link UnitOfWork} bound to the current thread
 *
 * @param <UOW> the {@link UnitOfWork} sub-type returned by the {@link UnitOfWorkFactory}
 */
public interface UnitOfWorkFactory<UOW extends UnitOfWork> {
    Logger unitOfWorkLog = LoggerFactory.getLogger(UnitOfWorkFactory.class);

    /**
     * Get the active {@link UnitOfWork}
     *
     * @return the active {@link UnitOfWork}
     * @throws NoActiveUnitOfWorkException if there is no active {@link UnitOfWork}
     */
    UOW getRequiredUnitOfWork();

    /**
     * Get the current {@link UnitOfWork} or create and start a new one if none is active
     */
    UOW getOrCreateNewUnitOfWork();

    Optional<UOW> getCurrentUnitOfWork();

    /**
     * Run <code>unitOfWorkConsumer</code> inside a {@link UnitOfWork}.<br>
     * If a {@link UnitOfWork} is already active it is reused and left for its owner to complete, otherwise a new one
     * is created and committed (or rolled back if <code>unitOfWorkConsumer</code> fails)
     */
    default void usingUnitOfWork(CheckedConsumer<UOW> unitOfWorkConsumer) {
        requireNonNull(unitOfWorkConsumer, "No unitOfWorkConsumer provided");
        withUnitOfWork(unitOfWork -> {
            unitOfWorkConsumer.accept(unitOfWork);
            return null;
        });
    }

    /**
     * Run <code>unitOfWorkFunction</code> inside a {@link UnitOfWork} and return its result.<br>
     * Exceptions thrown by <code>unitOfWorkFunction</code> are rethrown as is if unchecked, otherwise wrapped in a {@link UnitOfWorkException}
     *
     * @see #usingUnitOfWork(CheckedConsumer)
     */
    default <R> R withUnitOfWork(CheckedFunction<UOW, R> unitOfWorkFunction) {
        requireNonNull(unitOfWorkFunction, "No unitOfWorkFunction provided");
        var existingUnitOfWork = getCurrentUnitOfWork();
        var unitOfWork = existingUnitOfWork.orElseGet(() -> {
            unitOfWorkLog.trace("Creating a new UnitOfWork as there wasn't an existing UnitOfWork");
            return getOrCreateNewUnitOfWork();
        });
        try {
            var result = unitOfWorkFunction.apply(unitOfWork);
            if (existingUnitOfWork.isEmpty()) {
                unitOfWorkLog.trace("Committing the UnitOfWork created by this withUnitOfWork call");
                unitOfWork.commit();
            } else {
                unitOfWorkLog.trace("NestedUnitOfWork: Won't commit the UnitOfWork as it wasn't created by this withUnitOfWork call");
            }
            return result;
        } catch (Exception e) {
            if (existingUnitOfWork.isEmpty()) {
                unitOfWorkLog.debug("Rolling back the UnitOfWork created by this withUnitOfWork call");
                unitOfWork.rollback(e);
            } else {
                unitOfWorkLog.debug("NestedUnitOfWork: Marking UnitOfWork as rollback only as it wasn't created by this withUnitOfWork call");
                unitOfWork.markAsRollbackOnly(e);
            }
            if (e instanceof RuntimeException) {
                throw (RuntimeException) e;
            }
            throw new UnitOfWorkException(e);
        }
    }
}
