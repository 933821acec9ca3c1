/** Pool settings and their JSON loader. */
package com.example.txflow.core.config;
