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
package ru.nts.tools.pbip.core;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ExternalChangeTrackerTest {

    @Test
    void testDetectsChangedChecksum() {
        ExternalChangeTracker tracker = new ExternalChangeTracker();
        Path file = Path.of("model", "tables", "Sales.tmdl");
        tracker.registerSnapshot(file, 0xABCL, 10);

        assertFalse(tracker.checkForExternalChange(file, 0xABCL).hasExternalChange());

        ExternalChangeTracker.ExternalChangeResult change = tracker.checkForExternalChange(file, 0xDEFL);
        assertTrue(change.hasExternalChange());
        assertTrue(change.changeDescription().contains("Sales.tmdl"));
    }

    @Test
    void testUnknownFileIsUnchanged() {
        ExternalChangeTracker tracker = new ExternalChangeTracker();
        assertFalse(tracker.checkForExternalChange(Path.of("other.json"), 1).hasExternalChange());
        assertEquals(0, tracker.getTrackedFilesCount());
    }
}
