/**
 * Internal utilities: the pluggable JSON codec and the daemon thread factory.
 */
package jobqueue.util;
