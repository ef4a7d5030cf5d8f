// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

/// Jetty handlers exposing the engine over HTTP: the server-sent event stream and the source listing.
/// Documentation on the Handler programming interface:
/// https://eclipse.dev/jetty/documentation/jetty-12/programming-guide/index.html#pg-server-http-handler-impl-request
package io.pfive.logtail.http.handler;
