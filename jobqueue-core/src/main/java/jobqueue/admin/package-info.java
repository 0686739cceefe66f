/**
 * Operator tools: look up, count and reset jobs.
 */
package jobqueue.admin;
