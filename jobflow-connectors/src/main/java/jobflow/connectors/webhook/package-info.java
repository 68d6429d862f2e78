/**
 * HTTP webhook delivery with optional authentication, HMAC signing and batch endpoint.
 */
package jobflow.connectors.webhook;
