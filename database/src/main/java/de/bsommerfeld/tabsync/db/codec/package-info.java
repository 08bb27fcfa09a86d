/**
 * Row-to-entity mapping for the {@code clients} and {@code tabs} tables and
 * the JSON form of tab history.
 */
package de.bsommerfeld.tabsync.db.codec;
