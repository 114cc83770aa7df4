/**
 * Progress tracking.
 *
 * <p>A watermark is the highest source identifier that was resolved, either forwarded or
 * permanently skipped, for one account, host and folder.
 * <br>It is read before any mutation and written after every resolution, never before.
 * <br>It does not filter candidates: the unseen flag on the source does that.
 * The watermark records that earlier skip decisions were final.
 */
package com.mimecast.forwarder.state;
