/*
 * Copyright 2020 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.eventum.example.domain.diary.domainevents;

import java.util.Optional;

public enum UserEventType {
    USER_REGISTERED("UserRegistered"),
    USER_PROFILE_UPDATED("UserProfileUpdated"),
    USER_ARCHETYPE_ASSIGNED("UserArchetypeAssigned"),
    USER_ARCHETYPE_UPDATED("UserArchetypeUpdated"),
    USER_MODALITIES_UPDATED("UserModalitiesUpdated");

    public final String value;

    UserEventType(String value) {
        this.value = value;
    }

    public static Optional<UserEventType> fromValue(String value) {
        for (UserEventType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
