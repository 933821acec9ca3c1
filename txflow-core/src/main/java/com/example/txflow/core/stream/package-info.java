/**
 * Pull-based iteration over push-style streaming queries, one row in flight at a time.
 */
package com.example.txflow.core.stream;
