/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.tools.pbip;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Тестовый PBIP проект "Shop": таблицы Sales и Customer, связь между ними
 * и отчет в формате PBIR с одним визуалом.
 */
public final class TestProjects {

    public static final String MODEL_TMDL = String.join("\n",
            "model Model",
            "\tculture: en-US",
            "\tdefaultPowerBIDataSourceVersion: powerBI_V3",
            "",
            "ref table Sales",
            "ref table Customer",
            "");

    public static final String SALES_TMDL = String.join("\n",
            "table Sales",
            "\tlineageTag: 6d1c0a52-0001",
            "",
            "\tmeasure 'Total Sales' = SUM(Sales[Amount])",
            "\t\tformatString: #,0.00",
            "",
            "\tmeasure 'Avg Sale' = DIVIDE([Total Sales], COUNTROWS('Sales'))",
            "",
            "\tcolumn Amount",
            "\t\tdataType: decimal",
            "\t\tsourceColumn: Amount",
            "",
            "\tcolumn CustomerId",
            "\t\tdataType: int64",
            "\t\tsourceColumn: CustomerId",
            "",
            "\tpartition Sales = m",
            "\t\tmode: import",
            "\t\tsource =",
            "\t\t\t\tlet",
            "\t\t\t\t    Source = Csv.Document(File.Contents(\"sales.csv\"))",
            "\t\t\t\tin",
            "\t\t\t\t    Source",
            "");

    public static final String CUSTOMER_TMDL = String.join("\n",
            "table Customer",
            "",
            "\tcolumn CustomerId",
            "\t\tdataType: int64",
            "\t\tsourceColumn: CustomerId",
            "",
            "\tcolumn Name",
            "\t\tdataType: string",
            "\t\tsourceColumn: Name",
            "\t\tsortByColumn: CustomerId",
            "",
            "\tmeasure 'Customer Count' = DISTINCTCOUNT(Customer[CustomerId])",
            "");

    public static final String RELATIONSHIPS_TMDL = String.join("\n",
            "relationship 0b7e8f52-3a1d-4c55-9a0e-1f2a3b4c5d6e",
            "\tfromColumn: Sales.CustomerId",
            "\ttoColumn: Customer.CustomerId",
            "");

    public static final String VISUAL_JSON = """
            {
              "$schema": "https://developer.microsoft.com/json-schemas/fabric/item/report/definition/visualContainer/1.0.0/schema.json",
              "name": "v1",
              "visual": {
                "visualType": "clusteredColumnChart",
                "query": {
                  "queryState": {
                    "Category": {
                      "projections": [
                        {
                          "field": {
                            "Column": {
                              "Expression": { "SourceRef": { "Entity": "Customer" } },
                              "Property": "Name"
                            }
                          },
                          "queryRef": "Customer.Name",
                          "nativeQueryRef": "Name"
                        }
                      ]
                    },
                    "Y": {
                      "projections": [
                        {
                          "field": {
                            "Measure": {
                              "Expression": { "SourceRef": { "Entity": "Sales" } },
                              "Property": "Total Sales"
                            }
                          },
                          "queryRef": "Sales.Total Sales",
                          "nativeQueryRef": "Total Sales"
                        }
                      ]
                    }
                  }
                }
              },
              "filterConfig": {
                "filters": [
                  {
                    "name": "f1",
                    "field": {
                      "Column": {
                        "Expression": { "SourceRef": { "Entity": "Sales" } },
                        "Property": "Amount"
                      }
                    }
                  }
                ]
              }
            }
            """;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TestProjects() {
    }

    /**
     * Создает проект Shop в {@code dir} и возвращает корень проекта.
     */
    public static Path createShop(Path dir) throws IOException {
        write(dir.resolve("Shop.pbip"), """
                {
                  "version": "1.0",
                  "artifacts": [ { "report": { "path": "Shop.Report" } } ]
                }
                """);
        write(dir.resolve("Shop.SemanticModel/definition.pbism"), "{\"version\": \"4.0\"}\n");
        write(model(dir, "model.tmdl"), MODEL_TMDL);
        write(model(dir, "relationships.tmdl"), RELATIONSHIPS_TMDL);
        write(model(dir, "tables/Sales.tmdl"), SALES_TMDL);
        write(model(dir, "tables/Customer.tmdl"), CUSTOMER_TMDL);

        write(dir.resolve("Shop.Report/definition.pbir"), "{\"version\": \"4.0\"}\n");
        write(report(dir, "report.json"), "{\n  \"themeCollection\": {}\n}\n");
        write(report(dir, "pages/p1/page.json"), "{\n  \"name\": \"p1\",\n  \"displayName\": \"Page 1\"\n}\n");
        write(visual(dir), VISUAL_JSON);
        write(dir.resolve("Shop.Report/.pbi/localSettings.json"), "{\"Entity\": \"Sales\"}\n");
        return dir;
    }

    /**
     * Отчет в старом формате: один report.json, визуалы описаны строкой {@code config} с вложенным JSON.
     */
    public static Path writeLegacyReport(Path dir) throws IOException {
        ObjectNode inner = MAPPER.createObjectNode();
        ObjectNode single = inner.putObject("singleVisual");
        single.put("visualType", "card");
        single.putObject("projections").putArray("Values").addObject().put("queryRef", "Sales.Total Sales");
        ObjectNode prototype = single.putObject("prototypeQuery");
        prototype.putArray("From").addObject().put("Name", "s").put("Entity", "Sales").put("Type", 0);
        ObjectNode select = prototype.putArray("Select").addObject();
        ObjectNode measure = select.putObject("Measure");
        measure.putObject("Expression").putObject("SourceRef").put("Source", "s");
        measure.put("Property", "Total Sales");
        select.put("Name", "Sales.Total Sales");

        ObjectNode root = MAPPER.createObjectNode();
        root.put("config", "{\"version\":\"5.43\"}");
        ArrayNode sections = root.putArray("sections");
        ObjectNode section = sections.addObject();
        section.put("name", "ReportSection");
        section.put("displayName", "Page 1");
        section.putArray("visualContainers").addObject()
                .put("x", 10)
                .put("config", MAPPER.writeValueAsString(inner))
                .put("filters", "[]");

        Path file = dir.resolve("Legacy.Report/report.json");
        write(file, MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(root) + "\n");
        return file;
    }

    public static Path model(Path root, String relative) {
        return root.resolve("Shop.SemanticModel/definition").resolve(relative);
    }

    public static Path report(Path root, String relative) {
        return root.resolve("Shop.Report/definition").resolve(relative);
    }

    public static Path visual(Path root) {
        return report(root, "pages/p1/visuals/v1/visual.json");
    }

    public static void write(Path file, String text) throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, text, StandardCharsets.UTF_8);
    }

    public static String read(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    /**
     * Содержимое всех файлов под {@code root} (для проверки, что ничего не изменилось).
     */
    public static Map<Path, String> snapshot(Path root) throws IOException {
        Map<Path, String> result = new TreeMap<>();
        try (Stream<Path> walk = Files.walk(root)) {
            walk.filter(Files::isRegularFile).forEach(p -> {
                try {
                    result.put(root.relativize(p), Files.readString(p, StandardCharsets.UTF_8));
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        }
        return result;
    }
}
