/**
 * Broker topology and the pooled-connection factory that declares it.
 */
package io.courier.broker;
