package com.librarylending.eventstore.persistence;

import org.jdbi.v3.core.statement.StatementContext;
import org.slf4j.*;

import java.sql.SQLException;
import java.time.Duration;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Jdbi {@link org.jdbi.v3.core.statement.SqlLogger} installed by the PostgresqlEventStore.<br>
 * Enable TRACE on the <code>EventStore.Sql</code> logger to see every statement with its execution time.
 */
public class EventStoreSqlLogger implements org.jdbi.v3.core.statement.SqlLogger {
    private final Logger log;

    public EventStoreSqlLogger() {
        log = LoggerFactory.getLogger("EventStore.Sql");
    }

    @Override
    public void logAfterExecution(StatementContext context) {
        if (log.isTraceEnabled()) {
            log.trace("Execution time: {} ms - {}", Duration.between(context.getExecutionMoment(), context.getCompletionMoment()).toMillis(), context.getRenderedSql());
        }
    }

    @Override
    public void logException(StatementContext context, SQLException ex) {
        log.debug(msg("Failed Execution time: {} ms - {}", Duration.between(context.getExecutionMoment(), context.getExceptionMoment()).toMillis(), context.getRenderedSql()), ex);
    }
}
