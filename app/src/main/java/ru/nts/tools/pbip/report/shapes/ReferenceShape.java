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

import java.util.Set;

/**
 * Обработчик одной формы ссылки. Регистрируется в {@link ShapeRegistry} под ключами
 * JSON-объекта, на которых эта форма начинается.
 */
public interface ReferenceShape {

    ShapeKind kind();

    /**
     * Ключи членов объекта, для которых вызывается обработчик.
     */
    Set<String> keys();

    /**
     * @param owner Объект, содержащий член.
     * @param key   Ключ члена.
     * @param value Значение члена.
     * @param scan  Накопитель результатов.
     */
    void collect(BindingNode owner, String key, BindingNode value, ShapeScan scan);
}
