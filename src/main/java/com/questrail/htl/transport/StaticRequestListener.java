package com.questrail.htl.transport;

/**
 * StaticRequestListener
 * -----------------------------------------------------------------------------
 * Answers requests received by a {@link StaticEndpoint}.
 *
 * <p>Calls may arrive concurrently from several transport threads.</p>
 */
public interface StaticRequestListener
{
    /**
     * @param method request method, upper case (e.g. {@code GET})
     * @param path decoded request path without the query string
     * @return the response to send; never {@code null}
     */
    StaticResponse onRequest(String method, String path);
}
