package io.github.goodees.eventcontext.store.jdbc;

/*-
 * #%L
 * eventcontext
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.goodees.eventcontext.store.document.DocumentStoreClient;
import io.github.goodees.eventcontext.store.document.DocumentStoreException;
import io.github.goodees.eventcontext.store.document.VersionedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Document store on a relational table. The optimistic lock is the version column: a new document is inserted,
 * and its primary key rejects a concurrent insert; an existing one is updated with {@code WHERE VERSION=?}, and an
 * update of zero rows means someone else wrote first.
 */
public class JdbcDocumentStore implements DocumentStoreClient {
    private static final Logger logger = LoggerFactory.getLogger(JdbcDocumentStore.class);

    private final DataSource dataSource;
    private final DocumentSchema schema;
    private final TxHandler txHandler;

    public JdbcDocumentStore(DataSource dataSource, DocumentSchema schema) {
        this(dataSource, schema, CONTAINER_HANDLER);
    }

    public JdbcDocumentStore(DataSource dataSource, DocumentSchema schema, TxHandler handler) {
        this.dataSource = dataSource;
        this.schema = schema;
        this.txHandler = handler;
    }

    @Override
    public Optional<VersionedDocument> get(String key) throws DocumentStoreException {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement select = schema.selectDocument(connection, key);
                ResultSet rs = select.executeQuery()) {
            if (rs.next()) {
                return Optional.of(new VersionedDocument(key, schema.readVersion(rs), schema.readBody(rs)));
            } else {
                return Optional.empty();
            }
        } catch (SQLException e) {
            throw new DocumentStoreException("Cannot read document " + key, e);
        }
    }

    @Override
    public boolean put(String key, long expectedVersion, long newVersion, String body) throws DocumentStoreException {
        try (Connection connection = txHandler.enroll(dataSource.getConnection())) {
            try {
                boolean written = expectedVersion == 0
                        ? insert(connection, key, newVersion, body)
                        : update(connection, key, expectedVersion, newVersion, body);
                if (written) {
                    txHandler.commit(connection);
                } else {
                    txHandler.rollback(connection);
                }
                return written;
            } catch (SQLException | RuntimeException e) {
                txHandler.rollback(connection);
                throw e;
            }
        } catch (SQLException ex) {
            throw new DocumentStoreException("Store of document " + key + " failed. " + ex.getMessage(), ex);
        }
    }

    private boolean insert(Connection connection, String key, long newVersion, String body) throws SQLException {
        try (PreparedStatement insert = schema.insertDocument(connection, key, newVersion, body)) {
            return insert.executeUpdate() == 1;
        } catch (SQLException e) {
            if (schema.isDuplicateKey(e)) {
                logger.debug("Document {} was created concurrently", key);
                return false;
            }
            throw e;
        }
    }

    private boolean update(Connection connection, String key, long expectedVersion, long newVersion, String body)
            throws SQLException {
        try (PreparedStatement update = schema.updateDocument(connection, key, expectedVersion, newVersion, body)) {
            return update.executeUpdate() == 1;
        }
    }

    /**
     * Transaction demarcation around a single write.
     */
    public interface TxHandler {

        Connection enroll(Connection connection) throws SQLException;

        void commit(Connection connection) throws SQLException;

        void rollback(Connection connection) throws SQLException;
    }

    /**
     * Leaves transactions to the container, or to auto-commit of the connection.
     */
    public static final TxHandler CONTAINER_HANDLER = new TxHandler() {
        @Override
        public Connection enroll(Connection connection) {
            return connection;
        }

        @Override
        public void commit(Connection connection) {
        }

        @Override
        public void rollback(Connection connection) {
        }
    };

    /**
     * Runs every write in its own local transaction.
     */
    public static final TxHandler LOCAL_HANDLER = new TxHandler() {
        @Override
        public Connection enroll(Connection connection) throws SQLException {
            connection.setAutoCommit(false);
            return connection;
        }

        @Override
        public void commit(Connection connection) throws SQLException {
            connection.commit();
        }

        @Override
        public void rollback(Connection connection) throws SQLException {
            connection.rollback();
        }
    };
}
