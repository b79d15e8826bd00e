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

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * SQL dialect of the document table. Subclasses may override single statements to adapt to database specifics or
 * different column names.
 */
public abstract class DocumentSchema {

    protected abstract PreparedStatement selectDocument(Connection connection, String key) throws SQLException;

    protected abstract long readVersion(ResultSet rs) throws SQLException;

    protected abstract String readBody(ResultSet rs) throws SQLException;

    protected abstract PreparedStatement insertDocument(Connection connection, String key, long version, String body)
            throws SQLException;

    protected abstract PreparedStatement updateDocument(Connection connection, String key, long expectedVersion,
            long newVersion, String body) throws SQLException;

    /**
     * Recognize failure of insert caused by document that already exists.
     * @param e exception thrown by insert
     * @return true if the exception is a unique key violation
     */
    protected boolean isDuplicateKey(SQLException e) {
        String state = e.getSQLState();
        return state != null && state.startsWith("23");
    }
}
