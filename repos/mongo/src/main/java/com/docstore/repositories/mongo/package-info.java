/**
 * MongoDB implementation of the DocumentStore interface.
 *
 * JSON payloads are parsed into StoreDocuments, converted to BSON and sent
 * to a single collection through the synchronous driver. Results come back
 * as StoreDocuments; delete and update outcomes are reported as the
 * driver's raw counts.
 */
package com.docstore.repositories.mongo;
