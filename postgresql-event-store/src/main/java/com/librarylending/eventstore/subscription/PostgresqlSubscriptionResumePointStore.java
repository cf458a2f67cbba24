package com.librarylending.eventstore.subscription;

import com.librarylending.common.transaction.JdbiUnitOfWorkFactory;
import com.librarylending.common.types.SubscriberId;
import com.librarylending.eventstore.types.GlobalPosition;
import org.slf4j.*;

import java.time.OffsetDateTime;
import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.NamedArgumentBinding.arg;
import static dk.cloudcreate.essentials.shared.MessageFormatter.*;

/**
 * {@link SubscriptionResumePointStore} backed by the <code>subscription_resume_points</code> table, which is created on
 * start-up if it doesn't exist
 */
public class PostgresqlSubscriptionResumePointStore implements SubscriptionResumePointStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresqlSubscriptionResumePointStore.class);

    public static final String DEFAULT_RESUME_POINTS_TABLE_NAME = "subscription_resume_points";

    private final JdbiUnitOfWorkFactory unitOfWorkFactory;
    private final String                tableName;

    public PostgresqlSubscriptionResumePointStore(JdbiUnitOfWorkFactory unitOfWorkFactory) {
        this.unitOfWorkFactory = requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
        this.tableName = DEFAULT_RESUME_POINTS_TABLE_NAME;
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            unitOfWork.handle().execute(bind("CREATE TABLE IF NOT EXISTS {:tableName} (\n" +
                                                     "   subscriber_id text PRIMARY KEY,\n" +
                                                     "   resume_from_and_including bigint NOT NULL,\n" +
                                                     "   last_updated TIMESTAMP WITH TIME ZONE NOT NULL\n" +
                                                     ")",
                                             arg("tableName", tableName)));
            log.info("Ensured the '{}' table exists", tableName);
        });
    }

    @Override
    public Optional<SubscriptionResumePoint> load(SubscriberId subscriberId) {
        requireNonNull(subscriberId, "No subscriberId provided");
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> unitOfWork.handle()
                                                                        .createQuery(bind("SELECT * FROM {:tableName} WHERE subscriber_id = :subscriberId",
                                                                                          arg("tableName", tableName)))
                                                                        .bind("subscriberId", subscriberId.value())
                                                                        .map((rs, ctx) -> new SubscriptionResumePoint(SubscriberId.of(rs.getString("subscriber_id")),
                                                                                                                      GlobalPosition.of(rs.getLong("resume_from_and_including")),
                                                                                                                      rs.getObject("last_updated", OffsetDateTime.class)))
                                                                        .findOne());
    }

    @Override
    public void save(SubscriptionResumePoint resumePoint) {
        requireNonNull(resumePoint, "No resumePoint provided");
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> unitOfWork.handle()
                                                                  .createUpdate(bind("INSERT INTO {:tableName} (subscriber_id, resume_from_and_including, last_updated)\n" +
                                                                                             "  VALUES (:subscriberId, :resumeFromAndIncluding, :lastUpdated)\n" +
                                                                                             "  ON CONFLICT (subscriber_id) DO UPDATE SET\n" +
                                                                                             "     resume_from_and_including = EXCLUDED.resume_from_and_including,\n" +
                                                                                             "     last_updated = EXCLUDED.last_updated",
                                                                                     arg("tableName", tableName)))
                                                                  .bind("subscriberId", resumePoint.getSubscriberId().value())
                                                                  .bind("resumeFromAndIncluding", resumePoint.getResumeFromAndIncluding().longValue())
                                                                  .bind("lastUpdated", resumePoint.getLastUpdated())
                                                                  .execute());
    }

    @Override
    public void delete(SubscriberId subscriberId) {
        requireNonNull(subscriberId, "No subscriberId provided");
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> unitOfWork.handle()
                                                                  .createUpdate(bind("DELETE FROM {:tableName} WHERE subscriber_id = :subscriberId",
                                                                                     arg("tableName", tableName)))
                                                                  .bind("subscriberId", subscriberId.value())
                                                                  .execute());
    }
}
