package jobqueue.admin;

import jobqueue.model.JobRecord;
import jobqueue.model.JobStatus;
import jobqueue.spi.ConnectionProvider;
import jobqueue.spi.JobStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Operator facade for inspecting and resetting jobs.
 *
 * <p>Manages connection lifecycle internally using a {@link ConnectionProvider}.
 * Read failures are logged and reported as empty results.
 *
 * @see JobStore#reset
 */
public final class JobAdmin {
  private static final Logger logger = Logger.getLogger(JobAdmin.class.getName());

  private final ConnectionProvider connectionProvider;
  private final JobStore jobStore;
  private final Clock clock;

  public JobAdmin(ConnectionProvider connectionProvider, JobStore jobStore) {
    this(connectionProvider, jobStore, Clock.systemUTC());
  }

  public JobAdmin(ConnectionProvider connectionProvider, JobStore jobStore, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.jobStore = Objects.requireNonNull(jobStore, "jobStore");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public Optional<JobRecord> find(String jobId) {
    try (Connection conn = connectionProvider.getConnection()) {
      return jobStore.find(conn, jobId);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to load job: " + jobId, e);
      return Optional.empty();
    }
  }

  /**
   * Lists jobs in a status, oldest first.
   *
   * @param status status filter ({@code null} for all)
   * @param limit  maximum number of records
   */
  public List<JobRecord> query(JobStatus status, int limit) {
    try (Connection conn = connectionProvider.getConnection()) {
      return jobStore.queryByStatus(conn, status, limit);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to query jobs", e);
      return List.of();
    }
  }

  public int count(JobStatus status) {
    try (Connection conn = connectionProvider.getConnection()) {
      return jobStore.countByStatus(conn, status);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to count jobs", e);
      return 0;
    }
  }

  /**
   * Resets a job to UNCLAIMED, keeping its last result and completion count.
   *
   * @return {@code true} if the job exists and was reset
   */
  public boolean reset(String jobId) {
    return reset(jobId, true);
  }

  /**
   * Resets a job to UNCLAIMED.
   *
   * @param jobId           the job to reset
   * @param preserveHistory keep the last result and completion count
   * @return {@code true} if the job exists and was reset
   */
  public boolean reset(String jobId, boolean preserveHistory) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      boolean reset = jobStore.reset(conn, jobId, preserveHistory, clock.instant());
      if (reset) {
        logger.log(Level.INFO, "Job {0} reset to UNCLAIMED", jobId);
      }
      return reset;
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to reset job: " + jobId, e);
      return false;
    }
  }

  /**
   * Resets every job in {@code status}, in batches.
   *
   * @param status    status to reset; must not be UNCLAIMED
   * @param batchSize number of jobs per batch
   * @return total number of jobs reset
   */
  public int resetAll(JobStatus status, int batchSize) {
    Objects.requireNonNull(status, "status");
    if (status == JobStatus.UNCLAIMED) {
      throw new IllegalArgumentException("UNCLAIMED jobs need no reset");
    }
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    int totalReset = 0;
    List<JobRecord> batch;
    do {
      int batchReset = 0;
      try (Connection conn = connectionProvider.getConnection()) {
        conn.setAutoCommit(true);
        batch = jobStore.queryByStatus(conn, status, batchSize);
        for (JobRecord job : batch) {
          if (jobStore.reset(conn, job.jobId(), true, clock.instant())) {
            batchReset++;
          }
        }
      } catch (SQLException e) {
        logger.log(Level.SEVERE, "Failed to reset jobs batch", e);
        break;
      }
      totalReset += batchReset;
      if (batchReset == 0) {
        break;
      }
    } while (batch.size() >= batchSize);
    return totalReset;
  }
}
