/**
 * In-memory catalog lookup.
 */
package com.ryuqq.provisioning.adapter.inmemory.catalog;
