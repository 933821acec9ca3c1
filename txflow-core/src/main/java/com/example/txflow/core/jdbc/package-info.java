/** HikariCP-backed pool, the blocking transaction idiom and the {@code DbClient} facility. */
package com.example.txflow.core.jdbc;
