/**
 * Retention of finished job records.
 *
 * @see jobqueue.purge.JobPurgeScheduler
 */
package jobqueue.purge;
