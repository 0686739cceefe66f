/**
 * Core API of the job worker: job payloads and outcomes, the processing pipeline
 * contract, and the {@link jobqueue.JobWorker} composite.
 *
 * <p>Jobs arrive as queue messages. A worker claims the referenced job record
 * exclusively, runs the pipeline, writes the outcome and only then acknowledges the
 * message, so a crash at any point leaves either a redeliverable message or a claim
 * that goes stale and can be taken over.
 *
 * @see jobqueue.worker.WorkerLoop
 * @see jobqueue.spi.JobStore
 * @see jobqueue.spi.QueueGateway
 */
package jobqueue;
