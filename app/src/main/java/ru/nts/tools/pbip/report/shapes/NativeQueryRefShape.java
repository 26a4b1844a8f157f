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
package ru.nts.tools.pbip.report.shapes;

import ru.nts.tools.pbip.report.BindingNode;
import ru.nts.tools.pbip.report.shapes.BindingReference.MemberHint;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Отображаемое имя поля рядом с query reference. Переписывается, только если
 * соседняя ссылка указывает на переименованный член и текст совпадает с его именем.
 */
final class NativeQueryRefShape implements ReferenceShape {

    private static final Map<String, String> SIBLINGS = Map.of(
            "nativeQueryRef", "queryRef",
            "NativeReferenceName", "Name");

    @Override
    public ShapeKind kind() {
        return ShapeKind.NATIVE_QUERY_REF;
    }

    @Override
    public Set<String> keys() {
        return SIBLINGS.keySet();
    }

    @Override
    public void collect(BindingNode owner, String key, BindingNode value, ShapeScan scan) {
        if (!value.isString()) {
            return;
        }
        Optional<BindingReference> companion = owner.stringMember(SIBLINGS.get(key))
                .flatMap(sibling -> QueryRefShape.parse(sibling.token()));
        companion.ifPresent(c -> scan.add(new BindingReference(ShapeKind.NATIVE_QUERY_REF, value.token(), 0,
                value.stringValue().length(), null, null, MemberHint.ANY, c)));
    }
}
