package com.librarylending.common.transaction;

import org.jdbi.v3.core.Handle;

/**
 * {@link UnitOfWork} that's aware of the Jdbi {@link Handle} associated with it
 */
public interface HandleAwareUnitOfWork extends UnitOfWork {
    /**
     * @return the {@link org.jdbi.v3.core.Jdbi} handle
     * @throws UnitOfWorkException if the {@link UnitOfWork} isn't active
     */
    Handle handle();
}
