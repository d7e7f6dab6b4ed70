/**
 * Command-line entry points: the dispatcher and the {@code bucket}, {@code acl} and {@code status} commands.
 *
 * @since 0.1.0
 */
package ca.gc.cra.s3.api;
