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
package ru.nts.tools.pbip.rename;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlaceholderAllocatorTest {

    @Test
    void testSequentialNames() {
        PlaceholderAllocator allocator = new PlaceholderAllocator("__pbip_tmp_", List.of("Sales"));

        assertEquals("__pbip_tmp_1", allocator.next());
        assertEquals("__pbip_tmp_2", allocator.next());
        assertEquals("__pbip_tmp_", allocator.getPrefix());
    }

    @Test
    void testTakenNamesSkippedIgnoringCase() {
        PlaceholderAllocator allocator = new PlaceholderAllocator("__pbip_tmp_", List.of("__PBIP_TMP_1", "__pbip_tmp_3"));

        assertEquals("__pbip_tmp_2", allocator.next());
        assertEquals("__pbip_tmp_4", allocator.next());
    }
}
