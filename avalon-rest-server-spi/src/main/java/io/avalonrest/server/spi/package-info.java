/**
 * Collaborator seams of the request pipeline.
 *
 * <p>The SPI is blocking and minimal: rate limiting, token verification and block-record
 * persistence are plugged in through these interfaces and adapted by the host.
 */
package io.avalonrest.server.spi;
