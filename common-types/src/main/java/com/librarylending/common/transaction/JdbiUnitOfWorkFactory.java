package com.librarylending.common.transaction;

import org.jdbi.v3.core.*;
import org.slf4j.*;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * {@link HandleAwareUnitOfWorkFactory} that binds one {@link JdbiUnitOfWork} (and its open {@link Handle}/transaction)
 * to the current thread
 */
public class JdbiUnitOfWorkFactory implements HandleAwareUnitOfWorkFactory<JdbiUnitOfWorkFactory.JdbiUnitOfWork> {
    private static final Logger log = LoggerFactory.getLogger(JdbiUnitOfWorkFactory.class);

    private final Jdbi                        jdbi;
    private final ThreadLocal<JdbiUnitOfWork> unitOfWorks = new ThreadLocal<>();

    public JdbiUnitOfWorkFactory(Jdbi jdbi) {
        this.jdbi = requireNonNull(jdbi, "No jdbi instance provided");
    }

    public Jdbi getJdbi() {
        return jdbi;
    }

    @Override
    public JdbiUnitOfWork getRequiredUnitOfWork() {
        var unitOfWork = unitOfWorks.get();
        if (unitOfWork == null) {
            throw new NoActiveUnitOfWorkException("No active Unit of Work");
        }
        return unitOfWork;
    }

    @Override
    public JdbiUnitOfWork getOrCreateNewUnitOfWork() {
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
    public Optional<JdbiUnitOfWork> getCurrentUnitOfWork() {
        return Optional.ofNullable(unitOfWorks.get());
    }

    private void removeUnitOfWork() {
        log.trace("Removing UnitOfWork bound to the current thread");
        unitOfWorks.remove();
    }

    public static class JdbiUnitOfWork implements HandleAwareUnitOfWork {
        private final JdbiUnitOfWorkFactory unitOfWorkFactory;
        private       Handle                handle;
        private       UnitOfWorkStatus      status;
        private       Exception             causeOfRollback;

        private JdbiUnitOfWork(JdbiUnitOfWorkFactory unitOfWorkFactory) {
            this.unitOfWorkFactory = unitOfWorkFactory;
            status = UnitOfWorkStatus.Ready;
        }

        @Override
        public void start() {
            if (status == UnitOfWorkStatus.Started) {
                log.warn("The UnitOfWork was already started");
                return;
            }
            if (status != UnitOfWorkStatus.Ready) {
                throw new UnitOfWorkException(msg("Cannot start a UnitOfWork with status {}", status));
            }
            handle = unitOfWorkFactory.jdbi.open();
            handle.begin();
            status = UnitOfWorkStatus.Started;
        }

        @Override
        public void commit() {
            if (status == UnitOfWorkStatus.MarkedForRollbackOnly) {
                log.debug("UnitOfWork was marked for rollback only, rolling back instead of committing");
                rollback(causeOfRollback);
                return;
            }
            if (status != UnitOfWorkStatus.Started) {
                throw new UnitOfWorkException(msg("Cannot commit a UnitOfWork with status {}", status));
            }
            try {
                handle.commit();
                status = UnitOfWorkStatus.Committed;
            } finally {
                close();
            }
        }

        @Override
        public void rollback(Exception cause) {
            if (status == UnitOfWorkStatus.Started || status == UnitOfWorkStatus.MarkedForRollbackOnly) {
                causeOfRollback = cause != null ? cause : causeOfRollback;
                try {
                    handle.rollback();
                    status = UnitOfWorkStatus.RolledBack;
                } finally {
                    close();
                }
            } else if (!status.isCompleted) {
                throw new UnitOfWorkException(msg("Cannot rollback a UnitOfWork with status {}", status));
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
                throw new UnitOfWorkException(msg("Cannot mark a UnitOfWork with status {} as rollback only", status));
            }
        }

        @Override
        public Handle handle() {
            if (handle == null || status.isCompleted) {
                throw new UnitOfWorkException(msg("UnitOfWork with status {} doesn't have an active Handle", status));
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
