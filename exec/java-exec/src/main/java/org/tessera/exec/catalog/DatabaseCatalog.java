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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.tessera.common.concurrent.AutoCloseableLock;
import org.tessera.common.config.CommonConstants;
import org.tessera.common.config.TesseraConfig;
import org.tessera.common.exceptions.ErrorType;
import org.tessera.common.exceptions.UserException;
import org.tessera.common.logical.DatabaseEngineType;
import org.tessera.common.logical.data.CreateDatabasePlan;
import org.tessera.common.logical.data.DropDatabasePlan;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;

/**
 * Catalog of the databases known to this process, optionally backed by a remote catalog store.
 * <p>Local databases and table functions sit in two maps, each guarded by its own non-fair read-write lock. Reads
 * run in parallel; the write lock is only held for the local map update. Remote databases are looked up through
 * the {@link BackendClient} whenever {@link CommonConstants#CATALOG_STORE_ADDRESS} is set, and the remote store
 * arbitrates concurrent writes to them.
 */
public class DatabaseCatalog implements Catalog {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(DatabaseCatalog.class);

  /** First id of the system tables, inclusive. */
  public static final long SYS_TBL_ID_BEGIN = 1L << 62;
  /** End of the system table ids, exclusive. */
  public static final long SYS_TBL_ID_END = SYS_TBL_ID_BEGIN + 10000;
  /** First id of the local tables. Local ids run up to {@link Long#MAX_VALUE}. */
  public static final long LOCAL_TBL_ID_BEGIN = SYS_TBL_ID_END;

  private final String storeAddress;
  private final BackendClient backend;

  private final Map<String, Database> databases = new HashMap<>();
  private final ReadWriteLock databasesLock = new ReentrantReadWriteLock();
  private final AutoCloseableLock databasesReadLock = new AutoCloseableLock(databasesLock.readLock());
  private final AutoCloseableLock databasesWriteLock = new AutoCloseableLock(databasesLock.writeLock());

  private final Map<String, TableFunctionMeta> tableFunctions = new HashMap<>();
  private final ReadWriteLock tableFunctionsLock = new ReentrantReadWriteLock();
  private final AutoCloseableLock tableFunctionsReadLock = new AutoCloseableLock(tableFunctionsLock.readLock());
  private final AutoCloseableLock tableFunctionsWriteLock = new AutoCloseableLock(tableFunctionsLock.writeLock());

  public DatabaseCatalog(TesseraConfig config, BackendClient backend) {
    this.storeAddress = config.getString(CommonConstants.CATALOG_STORE_ADDRESS, "");
    this.backend = backend;
    logger.debug("Catalog created, remote store: {}", hasRemoteStore() ? storeAddress : "none");
  }

  @VisibleForTesting
  boolean hasRemoteStore() {
    return !storeAddress.isEmpty();
  }

  private static String key(String name) {
    return name.toLowerCase(Locale.ROOT);
  }

  @Override
  public void registerDatabase(List<Database> toRegister) {
    try (AutoCloseableLock lock = databasesWriteLock.open()) {
      for (Database database : toRegister) {
        databases.put(key(database.getName()), database);
        List<TableFunctionMeta> functions = database.getTableFunctions();
        try (AutoCloseableLock functionsLock = tableFunctionsWriteLock.open()) {
          for (TableFunctionMeta function : functions) {
            tableFunctions.put(key(function.getName()), function);
          }
        }
        logger.info("Registered database {} with {} table functions", database.getName(), functions.size());
      }
    }
  }

  @Override
  public Database getDatabase(String databaseName) {
    Database database;
    try (AutoCloseableLock lock = databasesReadLock.open()) {
      database = databases.get(key(databaseName));
    }
    if (database != null) {
      return database;
    }
    if (hasRemoteStore()) {
      return backend.getDatabase(databaseName);
    }
    throw UserException.unknownDatabaseError()
        .message("Unknown database %s", databaseName)
        .build(logger);
  }

  @Override
  public List<String> getDatabases() {
    List<String> names;
    try (AutoCloseableLock lock = databasesReadLock.open()) {
      names = new ArrayList<>(databases.keySet());
    }
    if (hasRemoteStore()) {
      names.addAll(backend.getDatabases());
    }
    Collections.sort(names);
    return names;
  }

  @Override
  public TableMeta getTable(String databaseName, String tableName) {
    return getDatabase(databaseName).getTable(tableName);
  }

  @Override
  public TableMeta getTableById(String databaseName, long tableId, Long tableVersion) {
    return getDatabase(databaseName).getTableById(tableId, tableVersion);
  }

  @Override
  public ListMultimap<String, TableMeta> getAllTables() {
    ListMultimap<String, TableMeta> results = MultimapBuilder.treeKeys().arrayListValues().build();
    Set<String> localNames = new HashSet<>();
    try (AutoCloseableLock lock = databasesReadLock.open()) {
      for (Entry<String, Database> entry : databases.entrySet()) {
        results.putAll(entry.getKey(), entry.getValue().getTables());
        localNames.add(entry.getKey());
      }
    }
    if (hasRemoteStore()) {
      // local and system databases shadow remote ones
      for (Entry<String, TableMeta> entry : backend.getAllTables().entries()) {
        if (!localNames.contains(key(entry.getKey()))) {
          results.put(entry.getKey(), entry.getValue());
        }
      }
    }
    return results;
  }

  @Override
  public TableFunctionMeta getTableFunction(String name) {
    TableFunctionMeta function;
    try (AutoCloseableLock lock = tableFunctionsReadLock.open()) {
      function = tableFunctions.get(key(name));
    }
    // remote databases provide no table functions
    if (function == null) {
      throw UserException.unknownTableFunctionError()
          .message("Unknown table function: '%s'", name)
          .build(logger);
    }
    return function;
  }

  @Override
  public void createDatabase(CreateDatabasePlan plan) {
    String name = key(plan.getDatabase());
    if (plan.getEngine() == DatabaseEngineType.LOCAL) {
      try (AutoCloseableLock lock = databasesWriteLock.open()) {
        if (databases.containsKey(name)) {
          alreadyExists(plan);
          return;
        }
        databases.put(name, new LocalDatabase(name));
      }
      logger.info("Created local database {}", name);
      return;
    }

    boolean exists;
    try (AutoCloseableLock lock = databasesReadLock.open()) {
      exists = databases.containsKey(name);
    }
    if (exists) {
      alreadyExists(plan);
      return;
    }
    backend.createDatabase(plan);
    logger.info("Created remote database {}", name);
  }

  /**
   * Accepts an existing database when the plan says {@code IF NOT EXISTS}, fails otherwise.
   */
  private void alreadyExists(CreateDatabasePlan plan) {
    if (!plan.isIfNotExists()) {
      throw UserException.databaseAlreadyExistsError()
          .message("Database: '%s' already exists.", plan.getDatabase())
          .build(logger);
    }
    logger.debug("Database {} already exists, nothing to create", plan.getDatabase());
  }

  @Override
  public void dropDatabase(DropDatabasePlan plan) {
    Database database;
    try {
      database = getDatabase(plan.getDatabase());
    } catch (UserException e) {
      if (e.getErrorType() != ErrorType.UNKNOWN_DATABASE) {
        throw e;
      }
      if (plan.isIfExists()) {
        logger.debug("Database {} does not exist, nothing to drop", plan.getDatabase());
        return;
      }
      throw UserException.unknownDatabaseError()
          .message("Unknown database: '%s'", plan.getDatabase())
          .build(logger);
    }

    if (database.isLocal()) {
      String name = key(plan.getDatabase());
      try (AutoCloseableLock lock = databasesWriteLock.open()) {
        databases.remove(name);
      }
      try (AutoCloseableLock lock = tableFunctionsWriteLock.open()) {
        tableFunctions.values().removeIf(function -> key(function.getDatabase()).equals(name));
      }
      logger.info("Dropped local database {}", name);
    } else {
      backend.dropDatabase(plan);
      logger.info("Dropped remote database {}", plan.getDatabase());
    }
  }
}
