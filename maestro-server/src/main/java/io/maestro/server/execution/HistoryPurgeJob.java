package io.maestro.server.execution;

import io.maestro.core.MaestroEnvironment;
import io.maestro.core.store.InMemoryRecordStore;
import io.maestro.core.store.RecordStore;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/// Scheduled job that drops finished requests from the task queue and the in-memory history.
///
/// On each tick, removes every request whose tasks are all terminal and finished longer than
/// the retention ago. Requests still in progress are never touched.
///
/// ### Configuration
/// | Property                   | Default | Description                              |
/// |----------------------------|---------|------------------------------------------|
/// | `maestro.purge.interval`   | `5m`    | How often finished requests are purged   |
/// | `maestro.purge.retention`  | `1h`    | Age after which a finished request goes  |
///
/// @implNote Thread-safe. Purging runs concurrently with request execution; the queue and the
/// store only drop requests that can no longer change.
@ApplicationScoped
public class HistoryPurgeJob {

    private static final Logger LOG = Logger.getLogger(HistoryPurgeJob.class);

    private final MaestroEnvironment environment;

    @ConfigProperty(name = "maestro.purge.retention", defaultValue = "1h")
    Duration retention;

    @Inject
    public HistoryPurgeJob(MaestroEnvironment environment) {
        this.environment = environment;
    }

    @Scheduled(every = "${maestro.purge.interval:5m}", delayed = "${maestro.purge.interval:5m}")
    void tick() {
        int tasks = environment.getTaskQueue().purgeTerminal(retention);
        int requests = 0;
        RecordStore store = environment.getRecordStore();
        if (store instanceof InMemoryRecordStore history) {
            requests = history.purgeFinished(retention);
        }
        if (tasks > 0 || requests > 0) {
            LOG.infov("Purged {0} task(s) and {1} request record(s)", tasks, requests);
        }
    }
}
