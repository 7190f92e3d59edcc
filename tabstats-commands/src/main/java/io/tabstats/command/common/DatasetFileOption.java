package io.tabstats.command.common;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.tabstats.dataset.Dataset;
import io.tabstats.dataset.DatasetLoader;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Shared options naming the delimited source file a command reads.
 */
public class DatasetFileOption {

    /** The World Happiness Report 2020 figure 2.1 export. */
    public static final String DEFAULT_INPUT = "WHR20_DataForFigure2.1.csv";

    @CommandLine.Option(
        names = {"-i", "--input"},
        description = "The delimited input file: header row, then one row per entity (default: ${DEFAULT-VALUE})",
        defaultValue = DEFAULT_INPUT
    )
    private Path input;

    @CommandLine.Option(
        names = {"--delimiter"},
        description = "Field delimiter character (default: '${DEFAULT-VALUE}')",
        defaultValue = ","
    )
    private char delimiter;

    public Path getInputPath() {
        return input;
    }

    public char getDelimiter() {
        return delimiter;
    }

    /**
     * Loads the dataset named by these options.
     *
     * @throws IOException if the file is absent or unreadable
     */
    public Dataset load() throws IOException {
        if (!Files.exists(input)) {
            throw new NoSuchFileException(input.toString(), null, "input file not found");
        }
        return new DatasetLoader(delimiter).load(input);
    }
}
