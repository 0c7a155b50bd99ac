/**
 * Alert delivery: channels, the dispatcher and the dispatch job.
 *
 * @since 1.0.0
 */
package com.kpisentinel.service.notify;
