/**
 * Static Server Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete HTTP implementation (Netty, or a test double) and the
 * route dispatching in {@code com.questrail.htl.runtime}.
 *
 * <p>Everything above the transport adapter sees only request method and path
 * as strings and responses as {@link com.questrail.htl.transport.StaticResponse}.
 * Netty types do not leave {@code transport.netty}.</p>
 */
package com.questrail.htl.transport;
