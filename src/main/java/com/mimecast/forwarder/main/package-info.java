/**
 * Scheduling of forwarding cycles.
 */
package com.mimecast.forwarder.main;
