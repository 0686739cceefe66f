/**
 * Domain model objects for the job worker.
 *
 * <p>Contains the queue delivery, the persisted job record, the claim handle
 * and the job lifecycle status.
 *
 * @see jobqueue.model.QueueMessage
 * @see jobqueue.model.JobRecord
 * @see jobqueue.model.JobClaim
 * @see jobqueue.model.JobStatus
 */
package jobqueue.model;
