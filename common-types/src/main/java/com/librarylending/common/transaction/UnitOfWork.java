package com.librarylending.common.transaction;

/**
 * A transactional unit of work, e.g. the appending of a batch of events to a stream
 */
public interface UnitOfWork {
    /**
     * Start the {@link UnitOfWork} and any underlying transaction
     */
    void start();

    /**
     * Commit the {@link UnitOfWork} and any underlying transaction - see {@link UnitOfWorkStatus#Committed}.<br>
     * If the {@link UnitOfWork} was {@link #markAsRollbackOnly(Exception)} it is rolled back instead
     */
    void commit();

    /**
     * Roll back the {@link UnitOfWork} and any underlying transaction - see {@link UnitOfWorkStatus#RolledBack}
     *
     * @param cause the cause of the rollback (may be null)
     */
    void rollback(Exception cause);

    default void rollback() {
        rollback(getCauseOfRollback());
    }

    UnitOfWorkStatus status();

    /**
     * The cause of a rollback or a {@link #markAsRollbackOnly(Exception)}
     */
    Exception getCauseOfRollback();

    void markAsRollbackOnly(Exception cause);
}
