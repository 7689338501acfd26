/**
 * Sessions, their prepared-statement caches and SQL capture.
 *
 * @see ledgerdb.session.Session
 * @see ledgerdb.session.StatementCache
 * @see ledgerdb.session.SqlCapture
 */
package ledgerdb.session;
