/**
 * The worker: queue consumption, the per-delivery state machine, retries through
 * redelivery, and recovery of abandoned claims.
 *
 * @see jobqueue.worker.WorkerLoop
 * @see jobqueue.worker.StuckJobReclaimer
 * @see jobqueue.worker.WorkerConfig
 */
package jobqueue.worker;
