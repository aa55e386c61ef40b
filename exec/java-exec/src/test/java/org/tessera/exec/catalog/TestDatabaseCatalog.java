/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.tessera.exec.catalog;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.Arrays;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.Before;
import org.junit.Test;
import org.junit.experimental.categories.Category;
import org.tessera.categories.CatalogTest;
import org.tessera.common.config.CommonConstants;
import org.tessera.common.config.TesseraConfig;
import org.tessera.common.exceptions.ErrorType;
import org.tessera.common.exceptions.UserException;
import org.tessera.common.logical.DatabaseEngineType;
import org.tessera.common.logical.data.CreateDatabasePlan;
import org.tessera.common.logical.data.DropDatabasePlan;
import org.tessera.common.types.Field;
import org.tessera.common.types.LogicalType;
import org.tessera.common.types.Schema;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;

@Category(CatalogTest.class)
public class TestDatabaseCatalog {

  private static final Schema SCHEMA = Schema.of(Field.of("a", LogicalType.INT32));

  private BackendClient backend;

  @Before
  public void setUp() {
    backend = mock(BackendClient.class);
  }

  private DatabaseCatalog localCatalog() {
    return new DatabaseCatalog(TesseraConfig.create(), backend);
  }

  private DatabaseCatalog remoteCatalog() {
    Properties props = new Properties();
    props.setProperty(CommonConstants.CATALOG_STORE_ADDRESS, "127.0.0.1:9191");
    return new DatabaseCatalog(TesseraConfig.create(props), backend);
  }

  private static void expectError(ErrorType type, Runnable action) {
    try {
      action.run();
      fail("expected " + type);
    } catch (UserException e) {
      assertEquals(type, e.getErrorType());
    }
  }

  @Test
  public void testCreateDatabaseTwice() {
    DatabaseCatalog catalog = localCatalog();
    catalog.createDatabase(new CreateDatabasePlan("db1", DatabaseEngineType.LOCAL, false));
    try {
      catalog.createDatabase(new CreateDatabasePlan("db1", DatabaseEngineType.LOCAL, false));
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.DATABASE_ALREADY_EXISTS, e.getErrorType());
      assertThat(e.getOriginalMessage(), containsString("db1"));
    }
    assertEquals(ImmutableList.of("db1"), catalog.getDatabases());
  }

  @Test
  public void testCreateDatabaseIfNotExists() {
    DatabaseCatalog catalog = localCatalog();
    catalog.createDatabase(new CreateDatabasePlan("db1", DatabaseEngineType.LOCAL, true));
    Database first = catalog.getDatabase("db1");
    catalog.createDatabase(new CreateDatabasePlan("DB1", DatabaseEngineType.LOCAL, true));
    assertSame(first, catalog.getDatabase("db1"));
    assertTrue(first.isLocal());
    assertEquals(DatabaseEngineType.LOCAL, first.getEngine());
  }

  @Test
  public void testNamesAreCaseInsensitive() {
    DatabaseCatalog catalog = localCatalog();
    catalog.createDatabase(new CreateDatabasePlan("Sales", DatabaseEngineType.LOCAL, false));
    assertEquals("sales", catalog.getDatabase("SALES").getName());
    expectError(ErrorType.DATABASE_ALREADY_EXISTS,
        () -> catalog.createDatabase(new CreateDatabasePlan("sales", DatabaseEngineType.LOCAL, false)));
  }

  @Test
  public void testUnknownDatabase() {
    DatabaseCatalog catalog = localCatalog();
    expectError(ErrorType.UNKNOWN_DATABASE, () -> catalog.getDatabase("missing"));
    expectError(ErrorType.UNKNOWN_DATABASE, () -> catalog.getTable("missing", "t"));
    verifyNoInteractions(backend);
  }

  @Test
  public void testDropDatabase() {
    DatabaseCatalog catalog = localCatalog();
    catalog.createDatabase(new CreateDatabasePlan("db1", DatabaseEngineType.LOCAL, false));
    catalog.dropDatabase(new DropDatabasePlan("db1", false));
    expectError(ErrorType.UNKNOWN_DATABASE, () -> catalog.getDatabase("db1"));
    expectError(ErrorType.UNKNOWN_DATABASE, () -> catalog.dropDatabase(new DropDatabasePlan("db1", false)));
    catalog.dropDatabase(new DropDatabasePlan("db1", true));
    assertTrue(catalog.getDatabases().isEmpty());
  }

  @Test
  public void testTables() {
    DatabaseCatalog catalog = localCatalog();
    catalog.createDatabase(new CreateDatabasePlan("db1", DatabaseEngineType.LOCAL, false));
    LocalDatabase database = (LocalDatabase) catalog.getDatabase("db1");
    TableMeta t1 = database.createTable("T1", SCHEMA);
    TableMeta t2 = database.createTable("t2", SCHEMA);

    assertTrue(t1.getId() >= DatabaseCatalog.LOCAL_TBL_ID_BEGIN);
    assertTrue(t2.getId() > t1.getId());
    assertEquals("t1", t1.getName());
    assertEquals("db1", t1.getDatabase());
    assertSame(t1, catalog.getTable("db1", "t1"));
    assertSame(t2, catalog.getTableById("db1", t2.getId(), null));
    assertSame(t2, catalog.getTableById("db1", t2.getId(), 0L));
    expectError(ErrorType.UNKNOWN_TABLE, () -> catalog.getTableById("db1", t2.getId(), 1L));
    expectError(ErrorType.UNKNOWN_TABLE, () -> catalog.getTable("db1", "t3"));
    expectError(ErrorType.SYSTEM, () -> database.createTable("t1", SCHEMA));

    database.dropTable("t1");
    expectError(ErrorType.UNKNOWN_TABLE, () -> catalog.getTable("db1", "t1"));
    expectError(ErrorType.UNKNOWN_TABLE, () -> database.dropTable("t1"));
  }

  @Test
  public void testSystemDatabase() {
    DatabaseCatalog catalog = localCatalog();
    catalog.registerDatabase(ImmutableList.of(new SystemDatabase()));

    TableMeta tables = catalog.getTable("system", "TABLES");
    assertTrue(tables.getId() >= DatabaseCatalog.SYS_TBL_ID_BEGIN);
    assertTrue(tables.getId() < DatabaseCatalog.SYS_TBL_ID_END);
    assertEquals(DatabaseCatalog.SYS_TBL_ID_BEGIN, catalog.getTable("system", "databases").getId());

    TableFunctionMeta numbers = catalog.getTableFunction("numbers");
    assertEquals("system", numbers.getDatabase());
    assertEquals(1, numbers.getNumArguments());
    assertEquals(LogicalType.UINT64, numbers.getSchema().getFields().get(0).getType());
    assertEquals("numbers_mt", catalog.getTableFunction("NUMBERS_MT").getName());
    expectError(ErrorType.UNKNOWN_TABLE_FUNCTION, () -> catalog.getTableFunction("generate_series"));

    catalog.dropDatabase(new DropDatabasePlan("system", false));
    expectError(ErrorType.UNKNOWN_TABLE_FUNCTION, () -> catalog.getTableFunction("numbers"));
  }

  @Test
  public void testAllTables() {
    DatabaseCatalog catalog = localCatalog();
    catalog.registerDatabase(ImmutableList.of(new SystemDatabase()));
    catalog.createDatabase(new CreateDatabasePlan("db1", DatabaseEngineType.LOCAL, false));
    TableMeta t1 = ((LocalDatabase) catalog.getDatabase("db1")).createTable("t1", SCHEMA);

    ListMultimap<String, TableMeta> all = catalog.getAllTables();
    assertEquals(ImmutableList.of(t1), all.get("db1"));
    assertEquals(new SystemDatabase().getTables(), all.get("system"));
    assertEquals(Arrays.asList("db1", "system"), ImmutableList.copyOf(all.keySet()));
  }

  @Test
  public void testRemoteFallback() {
    RemoteDatabase remote = new RemoteDatabase("remote_db", ImmutableList.of(
        new TableMeta(7, 3, "remote_db", "events", SCHEMA)));
    when(backend.getDatabase("remote_db")).thenReturn(remote);
    when(backend.getDatabase("nowhere")).thenThrow(UserException.unknownDatabaseError()
        .message("Unknown database nowhere")
        .build(org.slf4j.LoggerFactory.getLogger(TestDatabaseCatalog.class)));
    when(backend.getDatabases()).thenReturn(ImmutableList.of("remote_db", "a_remote"));

    DatabaseCatalog catalog = remoteCatalog();
    assertTrue(catalog.hasRemoteStore());
    catalog.createDatabase(new CreateDatabasePlan("local_db", DatabaseEngineType.LOCAL, false));

    assertSame(remote, catalog.getDatabase("remote_db"));
    assertEquals(7, catalog.getTable("remote_db", "events").getId());
    assertEquals(3, catalog.getTableById("remote_db", 7, 3L).getVersion());
    assertEquals(ImmutableList.of("a_remote", "local_db", "remote_db"), catalog.getDatabases());
    expectError(ErrorType.UNKNOWN_DATABASE, () -> catalog.getDatabase("nowhere"));
    // local databases never reach the backend
    catalog.getDatabase("local_db");
    verify(backend, never()).getDatabase("local_db");
  }

  @Test
  public void testRemoteTablesShadowedByLocal() {
    TableMeta shadowed = new TableMeta(1, 0, "db1", "old", SCHEMA);
    TableMeta visible = new TableMeta(2, 0, "db2", "events", SCHEMA);
    when(backend.getAllTables()).thenReturn(ImmutableListMultimap.of("db1", shadowed, "db2", visible));

    DatabaseCatalog catalog = remoteCatalog();
    catalog.createDatabase(new CreateDatabasePlan("db1", DatabaseEngineType.LOCAL, false));

    ListMultimap<String, TableMeta> all = catalog.getAllTables();
    assertTrue(all.get("db1").isEmpty());
    assertEquals(ImmutableList.of(visible), all.get("db2"));
  }

  @Test
  public void testRemoteCreateAndDrop() {
    DatabaseCatalog catalog = remoteCatalog();
    CreateDatabasePlan create = new CreateDatabasePlan("remote_db", DatabaseEngineType.REMOTE, false);
    catalog.createDatabase(create);
    verify(backend).createDatabase(create);

    when(backend.getDatabase("remote_db")).thenReturn(new RemoteDatabase("remote_db", ImmutableList.of()));
    DropDatabasePlan drop = new DropDatabasePlan("remote_db", false);
    catalog.dropDatabase(drop);
    verify(backend).dropDatabase(drop);
  }

  @Test
  public void testRemoteCreateShadowedByLocal() {
    DatabaseCatalog catalog = remoteCatalog();
    catalog.createDatabase(new CreateDatabasePlan("db1", DatabaseEngineType.LOCAL, false));
    expectError(ErrorType.DATABASE_ALREADY_EXISTS,
        () -> catalog.createDatabase(new CreateDatabasePlan("db1", DatabaseEngineType.REMOTE, false)));
    catalog.createDatabase(new CreateDatabasePlan("db1", DatabaseEngineType.REMOTE, true));
    verify(backend, never()).createDatabase(any());
  }

  @Test
  public void testConcurrentCreate() throws Exception {
    DatabaseCatalog catalog = localCatalog();
    int threads = 8;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    try {
      ImmutableList.Builder<Future<Boolean>> results = ImmutableList.builder();
      for (int i = 0; i < threads; i++) {
        results.add(executor.submit(() -> {
          start.await();
          try {
            catalog.createDatabase(new CreateDatabasePlan("shared", DatabaseEngineType.LOCAL, false));
            return true;
          } catch (UserException e) {
            assertEquals(ErrorType.DATABASE_ALREADY_EXISTS, e.getErrorType());
            return false;
          }
        }));
      }
      start.countDown();
      int created = 0;
      for (Future<Boolean> result : results.build()) {
        if (result.get(10, TimeUnit.SECONDS)) {
          created++;
        }
      }
      assertEquals(1, created);
      assertFalse(catalog.getDatabases().isEmpty());
    } finally {
      executor.shutdownNow();
    }
  }
}
