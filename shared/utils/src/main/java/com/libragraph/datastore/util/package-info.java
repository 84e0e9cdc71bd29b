/**
 * Address handling shared by all Datastore modules.
 *
 * <p>{@link com.libragraph.datastore.util.S3Paths} holds the pure string functions for
 * splitting, joining and re-rooting addresses. No framework dependencies.
 */
package com.libragraph.datastore.util;
