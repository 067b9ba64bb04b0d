/**
 * Internal helpers: thread naming and the JSON payload codec.
 */
package io.courier.util;
