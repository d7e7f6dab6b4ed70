/**
 * StAX adapter for the XML path event port.
 *
 * @since 0.1.0
 */
package ca.gc.cra.s3.infrastructure.xml;
