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
 * JDBC schema for a single document table. Following table is expected to exist:
 * <ul>
 * <li><em>documentTable</em>(ID varchar, VERSION bigint, BODY clob) primary key (ID)</li>
 * </ul>
 */
public class DefaultDocumentSchema extends DocumentSchema {

    private final String documentTable;

    public DefaultDocumentSchema(String documentTable) {
        this.documentTable = documentTable;
    }

    protected String getDocumentTable() {
        return documentTable;
    }

    @Override
    protected PreparedStatement selectDocument(Connection connection, String key) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT VERSION, BODY FROM " + getDocumentTable()
                + " WHERE ID=?");
        st.setString(1, key);
        return st;
    }

    @Override
    protected long readVersion(ResultSet rs) throws SQLException {
        return rs.getLong(1);
    }

    @Override
    protected String readBody(ResultSet rs) throws SQLException {
        return rs.getString(2);
    }

    @Override
    protected PreparedStatement insertDocument(Connection connection, String key, long version, String body)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("INSERT INTO " + getDocumentTable()
                + " (ID, VERSION, BODY) VALUES (?, ?, ?)");
        st.setString(1, key);
        st.setLong(2, version);
        st.setString(3, body);
        return st;
    }

    @Override
    protected PreparedStatement updateDocument(Connection connection, String key, long expectedVersion,
            long newVersion, String body) throws SQLException {
        PreparedStatement st = connection.prepareStatement("UPDATE " + getDocumentTable()
                + " SET VERSION=?, BODY=? WHERE ID=? AND VERSION=?");
        st.setLong(1, newVersion);
        st.setString(2, body);
        st.setString(3, key);
        st.setLong(4, expectedVersion);
        return st;
    }
}
