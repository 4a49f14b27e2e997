/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.gharchive.iceberg.utilities;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.Value;
import lombok.extern.log4j.Log4j2;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.hadoop.conf.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.annotations.VisibleForTesting;

import io.gharchive.iceberg.archive.HttpArchiveSource;
import io.gharchive.iceberg.archive.LocalArchiveSource;
import io.gharchive.iceberg.iceberg.EventTableConfig;
import io.gharchive.iceberg.iceberg.IcebergCatalogConfig;
import io.gharchive.iceberg.iceberg.IcebergEventTableWriter;
import io.gharchive.iceberg.iceberg.IcebergIngestionWatermark;
import io.gharchive.iceberg.iceberg.PartitionGranularity;
import io.gharchive.iceberg.ingest.FixedHourRangePlanner;
import io.gharchive.iceberg.ingest.HourIngestor;
import io.gharchive.iceberg.ingest.IngestionController;
import io.gharchive.iceberg.ingest.IngestionRunConfig;
import io.gharchive.iceberg.ingest.WatermarkHourRangePlanner;
import io.gharchive.iceberg.model.ArchiveKey;
import io.gharchive.iceberg.model.exception.ConfigurationException;
import io.gharchive.iceberg.model.ingest.IngestResult;
import io.gharchive.iceberg.spi.ArchiveSource;
import io.gharchive.iceberg.spi.HourRangePlanner;
import io.gharchive.iceberg.spi.IngestionWatermark;

/**
 * Provides a standalone runner for the ingestion. Ingests a single hour ({@code --date} and {@code
 * --hour}), a whole day ({@code --date}) or every completed hour after the table's watermark
 * ({@code --catchUp}).
 */
@Log4j2
public class RunIngest {

  public static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
  private static final String DATASET_CONFIG_OPTION = "d";
  private static final String DATE_OPTION = "D";
  private static final String HOUR_OPTION = "H";
  private static final String CATCH_UP_OPTION = "c";
  private static final String DRY_RUN_OPTION = "n";
  private static final String HADOOP_CONFIG_PATH = "p";
  private static final String ICEBERG_CATALOG_CONFIG_PATH = "i";
  private static final String HELP_OPTION = "h";

  private static final Options OPTIONS =
      new Options()
          .addRequiredOption(
              DATASET_CONFIG_OPTION,
              "datasetConfig",
              true,
              "The path to a yaml file containing the table and source configuration")
          .addOption(DATE_OPTION, "date", true, "The day to ingest, yyyy-MM-dd (UTC)")
          .addOption(
              HOUR_OPTION,
              "hour",
              true,
              "The hour of --date to ingest, 0-23. All 24 hours are ingested when omitted.")
          .addOption(
              CATCH_UP_OPTION,
              "catchUp",
              false,
              "Ingests every completed hour after the latest event in the table")
          .addOption(
              DRY_RUN_OPTION, "dryRun", false, "Only lists the hours that would be ingested")
          .addOption(
              HADOOP_CONFIG_PATH,
              "hadoopConfig",
              true,
              "Hadoop config xml file path containing configs necessary to access the "
                  + "file system. These configs will override the default configs.")
          .addOption(
              ICEBERG_CATALOG_CONFIG_PATH,
              "icebergCatalogConfig",
              true,
              "The path to a yaml file containing Iceberg catalog configuration. Without it the "
                  + "table is a Hadoop table under the warehouse path.")
          .addOption(HELP_OPTION, "help", false, "Displays help information to run this utility");

  public static void main(String[] args) throws IOException {
    CommandLine cmd;
    try {
      cmd = parseArgs(args);
    } catch (ParseException e) {
      log.error(e.getMessage());
      new HelpFormatter().printHelp("gharchive-iceberg.jar", OPTIONS, true);
      return;
    }

    if (cmd.hasOption(HELP_OPTION)) {
      HelpFormatter formatter = new HelpFormatter();
      formatter.printHelp("RunIngest", OPTIONS);
      return;
    }

    List<IngestResult> results = runIngest(cmd, Clock.systemUTC());
    if (results.stream().anyMatch(result -> !result.isSuccess() && !isDryRun(cmd))) {
      System.exit(1);
    }
  }

  @VisibleForTesting
  static CommandLine parseArgs(String[] args) throws ParseException {
    CommandLineParser parser = new DefaultParser();
    return parser.parse(OPTIONS, args);
  }

  @VisibleForTesting
  static List<IngestResult> runIngest(CommandLine cmd, Clock clock) throws IOException {
    DatasetConfig datasetConfig = getDatasetConfig(cmd.getOptionValue(DATASET_CONFIG_OPTION));
    Configuration hadoopConf = loadHadoopConf(getCustomConfigurations(cmd, HADOOP_CONFIG_PATH));
    IcebergCatalogConfig catalogConfig =
        loadIcebergCatalogConfig(getCustomConfigurations(cmd, ICEBERG_CATALOG_CONFIG_PATH));
    EventTableConfig tableConfig = datasetConfig.toTableConfig(catalogConfig);

    IcebergIngestionWatermark watermark = IcebergIngestionWatermark.of(tableConfig, hadoopConf);
    IngestRange range = ingestRange(cmd, datasetConfig, watermark, clock.instant());
    HourIngestor hourIngestor =
        HourIngestor.of(
            archiveSource(datasetConfig.getSource()),
            IcebergEventTableWriter.of(tableConfig, hadoopConf));
    IngestionRunConfig runConfig =
        IngestionRunConfig.builder()
            .dryRun(isDryRun(cmd))
            .parallelism(datasetConfig.getParallelism())
            .stopOnFailure(datasetConfig.isStopOnFailure())
            .build();
    log.info("Ingesting into {}", tableConfig.getBasePath());
    return IngestionController.of(hourIngestor)
        .run(range.getPlanner(), range.getEndKey(), runConfig);
  }

  @VisibleForTesting
  static IngestRange ingestRange(
      CommandLine cmd, DatasetConfig datasetConfig, IngestionWatermark watermark, Instant now) {
    if (cmd.hasOption(CATCH_UP_OPTION)) {
      if (cmd.hasOption(DATE_OPTION) || cmd.hasOption(HOUR_OPTION)) {
        throw new ConfigurationException("--catchUp can not be combined with --date or --hour");
      }
      ArchiveKey startKey = ArchiveKey.parse(datasetConfig.getStartKey());
      // the hour containing now is still being written
      return IngestRange.of(
          WatermarkHourRangePlanner.of(watermark, startKey), ArchiveKey.containing(now));
    }
    if (!cmd.hasOption(DATE_OPTION)) {
      throw new ConfigurationException("One of --date or --catchUp is required");
    }
    LocalDate date;
    try {
      date = LocalDate.parse(cmd.getOptionValue(DATE_OPTION), ArchiveKey.DATE_FORMAT);
    } catch (DateTimeParseException e) {
      throw new ConfigurationException("Invalid --date " + cmd.getOptionValue(DATE_OPTION), e);
    }
    if (!cmd.hasOption(HOUR_OPTION)) {
      return IngestRange.of(
          FixedHourRangePlanner.of(ArchiveKey.of(date, 0)), ArchiveKey.of(date.plusDays(1), 0));
    }
    ArchiveKey key;
    try {
      key = ArchiveKey.of(date, Integer.parseInt(cmd.getOptionValue(HOUR_OPTION)));
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Invalid --hour " + cmd.getOptionValue(HOUR_OPTION), e);
    }
    return IngestRange.of(FixedHourRangePlanner.of(key), key.next());
  }

  static ArchiveSource archiveSource(DatasetConfig.Source source) {
    if (source.getLocalDirectory() != null) {
      return LocalArchiveSource.of(Paths.get(source.getLocalDirectory()));
    }
    return HttpArchiveSource.builder()
        .baseUrl(source.getBaseUrl())
        .connectTimeout(Duration.ofSeconds(source.getConnectTimeoutSeconds()))
        .requestTimeout(Duration.ofSeconds(source.getRequestTimeoutSeconds()))
        .publicationDelay(Duration.ofMinutes(source.getPublicationDelayMinutes()))
        .maxRetries(source.getMaxRetries())
        .downloadDirectory(
            source.getDownloadDirectory() == null ? null : Paths.get(source.getDownloadDirectory()))
        .build();
  }

  private static boolean isDryRun(CommandLine cmd) {
    return cmd.hasOption(DRY_RUN_OPTION);
  }

  static DatasetConfig getDatasetConfig(String datasetConfigPath) throws IOException {
    try (InputStream inputStream = Files.newInputStream(Paths.get(datasetConfigPath))) {
      return YAML_MAPPER.readValue(inputStream, DatasetConfig.class);
    }
  }

  static byte[] getCustomConfigurations(CommandLine cmd, String option) throws IOException {
    byte[] customConfig = null;
    if (cmd.hasOption(option)) {
      customConfig = Files.readAllBytes(Paths.get(cmd.getOptionValue(option)));
    }
    return customConfig;
  }

  @VisibleForTesting
  static Configuration loadHadoopConf(byte[] customConfig) {
    Configuration conf = new Configuration();
    conf.addResource("gharchive-hadoop-defaults.xml");
    if (customConfig != null) {
      conf.addResource(new ByteArrayInputStream(customConfig), "customConfigStream");
    }
    return conf;
  }

  @VisibleForTesting
  static IcebergCatalogConfig loadIcebergCatalogConfig(byte[] customConfigs) throws IOException {
    return customConfigs == null
        ? null
        : YAML_MAPPER.readValue(customConfigs, IcebergCatalogConfig.class);
  }

  @Value
  @AllArgsConstructor(staticName = "of")
  static class IngestRange {
    HourRangePlanner planner;
    // exclusive
    ArchiveKey endKey;
  }

  @Data
  public static class DatasetConfig {

    /**
     * Root of the warehouse the table lives in. Any authentication configuration needed by the
     * Hadoop file system client should be provided through --hadoopConfig.
     */
    String warehousePath;

    String database = EventTableConfig.DEFAULT_DATABASE;

    String tableName = EventTableConfig.DEFAULT_TABLE_NAME;

    /** Transform of created_at the table is partitioned by, MONTH, DAY or HOUR. */
    PartitionGranularity partitionGranularity = PartitionGranularity.MONTH;

    /** First hour --catchUp ingests into an empty table, in the archive's yyyy-MM-dd-H notation. */
    String startKey = "2015-01-01-0";

    /** Properties of the table, applied when it is created. */
    Map<String, String> tableProperties = Collections.emptyMap();

    int parallelism = 1;

    boolean stopOnFailure = true;

    Source source = new Source();

    EventTableConfig toTableConfig(IcebergCatalogConfig catalogConfig) {
      if (warehousePath == null) {
        throw new ConfigurationException("warehousePath is required in the dataset config");
      }
      return EventTableConfig.builder()
          .warehousePath(warehousePath)
          .database(database)
          .tableName(tableName)
          .partitionGranularity(partitionGranularity)
          .tableProperties(tableProperties)
          .catalogConfig(catalogConfig)
          .build();
    }

    @Data
    public static class Source {
      /** Base url of the hourly archives. */
      String baseUrl = HttpArchiveSource.DEFAULT_BASE_URL;

      /** Reads the archives from this directory instead of downloading them when set. */
      String localDirectory;

      /** Minutes after the end of an hour during which a missing archive is not yet published. */
      long publicationDelayMinutes = 120;

      int maxRetries = 3;

      long connectTimeoutSeconds = 30;

      long requestTimeoutSeconds = 300;

      /** Where downloads are staged, the system temporary directory when unset. */
      String downloadDirectory;
    }
  }
}
