/**
 * Fixed-size session pool with guarded checkout.
 */
package ledgerdb.pool;
