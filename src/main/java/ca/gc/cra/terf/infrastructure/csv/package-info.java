/**
 * Jackson CSV implementation of the metadata table port.
 */
package ca.gc.cra.terf.infrastructure.csv;
