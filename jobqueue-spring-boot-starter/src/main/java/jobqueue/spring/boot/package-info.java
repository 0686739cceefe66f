/**
 * Spring Boot auto-configuration for the job worker, bound to {@code jobqueue.*} properties.
 */
package jobqueue.spring.boot;
