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

import org.h2.jdbcx.JdbcDataSource;
import org.junit.AfterClass;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.rules.TestName;
import org.springframework.jdbc.core.JdbcTemplate;

import static org.junit.Assert.assertEquals;

/**
 * H2 database with a document table named {@value #TABLE}, created once per test class.
 */
public abstract class JdbcTest {
    static final String TABLE = "document";

    protected static JdbcDataSource ds;
    protected static JdbcTemplate template;
    @Rule
    public TestName testName = new TestName();
    protected DefaultDocumentSchema schema;
    protected JdbcDocumentStore documentStore;

    static JdbcDataSource dataSource(String database) {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:" + database + ";DB_CLOSE_DELAY=-1");
        dataSource.setUser("sa");
        return dataSource;
    }

    static void createDocumentTable(JdbcTemplate template, String table) {
        template.execute("create table " + table + " (ID varchar(255) primary key, VERSION bigint, BODY clob)");
    }

    @BeforeClass
    public static void initDb() {
        ds = dataSource("doctest");
        template = new JdbcTemplate(ds);
        createDocumentTable(template, TABLE);
    }

    @AfterClass
    public static void dropDb() {
        template.execute("drop table " + TABLE);
    }

    @Before
    public void setUpStore() {
        this.schema = new DefaultDocumentSchema(TABLE);
        this.documentStore = new JdbcDocumentStore(ds, schema);
    }

    protected String name() {
        return testName.getMethodName();
    }

    protected void assertDb(long expected, String sql, Object... params) {
        assertEquals(Long.valueOf(expected), template.queryForObject(sql, Long.class, params));
    }

    protected long storedVersion(String table, String key) {
        return template.queryForObject("select version from " + table + " where id = ?", Long.class, key);
    }
}
