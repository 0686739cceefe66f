/**
 * Micrometer bridge for exporting worker metrics to Prometheus, Grafana, and other backends.
 *
 * @see jobqueue.micrometer.MicrometerMetricsExporter
 */
package jobqueue.micrometer;
