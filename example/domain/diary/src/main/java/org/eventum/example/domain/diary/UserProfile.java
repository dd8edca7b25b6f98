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

package org.eventum.example.domain.diary;

import org.eventum.aggregate.AbstractAggregate;
import org.eventum.aggregate.UnrecognizedEventTypeException;
import org.eventum.event.Event;
import org.eventum.example.domain.diary.domainevents.UserArchetypeAssigned;
import org.eventum.example.domain.diary.domainevents.UserArchetypeUpdated;
import org.eventum.example.domain.diary.domainevents.UserEventType;
import org.eventum.example.domain.diary.domainevents.UserModalitiesUpdated;
import org.eventum.example.domain.diary.domainevents.UserProfileUpdated;
import org.eventum.example.domain.diary.domainevents.UserRegistered;

import java.util.Collections;
import java.util.List;

import static org.eventum.example.domain.diary.domainevents.UserEventType.USER_ARCHETYPE_ASSIGNED;
import static org.eventum.example.domain.diary.domainevents.UserEventType.USER_ARCHETYPE_UPDATED;
import static org.eventum.example.domain.diary.domainevents.UserEventType.USER_MODALITIES_UPDATED;
import static org.eventum.example.domain.diary.domainevents.UserEventType.USER_PROFILE_UPDATED;
import static org.eventum.example.domain.diary.domainevents.UserEventType.USER_REGISTERED;
import static java.util.Objects.requireNonNull;

/**
 * A registered user of the diary, with the archetype and modalities derived from what they write.
 */
public class UserProfile extends AbstractAggregate {
    private String username = "";
    private String email = "";
    private String firstName = "";
    private String lastName = "";
    private String dateOfBirth = "";
    private String avatar = "";
    private String bio = "";
    private Archetype archetype;
    private List<UserModality> modalities = Collections.emptyList();

    public UserProfile(String id) {
        super(id);
    }

    public void register(String username, String email, String firstName, String lastName, String dateOfBirth) {
        requireNonNull(username, "Username cannot be null");
        if (isRegistered()) {
            throw new UserAlreadyExists(getId());
        }
        stage(newEvent(USER_REGISTERED.value, new UserRegistered(username, email, firstName, lastName, dateOfBirth)));
    }

    public void updateProfile(String firstName, String lastName, String dateOfBirth, String avatar, String bio) {
        verifyRegistered();
        stage(newEvent(USER_PROFILE_UPDATED.value, new UserProfileUpdated(firstName, lastName, dateOfBirth, avatar, bio)));
    }

    public void assignArchetype(String archetypeId, String archetypeName, double confidence, String description) {
        verifyRegistered();
        stage(newEvent(USER_ARCHETYPE_ASSIGNED.value, new UserArchetypeAssigned(archetypeId, archetypeName, confidence, description)));
    }

    public void updateArchetype(String archetypeId, String archetypeName, double confidence, String description) {
        verifyRegistered();
        stage(newEvent(USER_ARCHETYPE_UPDATED.value, new UserArchetypeUpdated(archetypeId, archetypeName, confidence, description)));
    }

    public void updateModalities(List<UserModality> modalities) {
        verifyRegistered();
        stage(newEvent(USER_MODALITIES_UPDATED.value, new UserModalitiesUpdated(modalities)));
    }

    private boolean isRegistered() {
        return !username.isEmpty();
    }

    private void verifyRegistered() {
        if (!isRegistered()) {
            throw new UserDoesNotExist(getId());
        }
    }

    @Override
    protected void when(Event event) {
        UserEventType type = UserEventType.fromValue(event.getType())
                .orElseThrow(() -> new UnrecognizedEventTypeException(UserProfile.class.getSimpleName(), event.getType()));
        switch (type) {
            case USER_REGISTERED:
                UserRegistered registered = payloadOf(event, UserRegistered.class);
                username = registered.username();
                email = registered.email();
                firstName = registered.firstName();
                lastName = registered.lastName();
                dateOfBirth = registered.dateOfBirth() == null ? "" : registered.dateOfBirth();
                break;
            case USER_PROFILE_UPDATED:
                UserProfileUpdated updated = payloadOf(event, UserProfileUpdated.class);
                firstName = valueOrCurrent(updated.firstName(), firstName);
                lastName = valueOrCurrent(updated.lastName(), lastName);
                dateOfBirth = valueOrCurrent(updated.dateOfBirth(), dateOfBirth);
                avatar = valueOrCurrent(updated.avatar(), avatar);
                bio = valueOrCurrent(updated.bio(), bio);
                break;
            case USER_ARCHETYPE_ASSIGNED:
                UserArchetypeAssigned assigned = payloadOf(event, UserArchetypeAssigned.class);
                archetype = new Archetype(assigned.archetypeId(), assigned.archetypeName(), assigned.description(), assigned.confidence());
                break;
            case USER_ARCHETYPE_UPDATED:
                UserArchetypeUpdated archetypeUpdated = payloadOf(event, UserArchetypeUpdated.class);
                archetype = new Archetype(archetypeUpdated.archetypeId(), archetypeUpdated.archetypeName(), archetypeUpdated.description(), archetypeUpdated.confidence());
                break;
            case USER_MODALITIES_UPDATED:
                List<UserModality> newModalities = payloadOf(event, UserModalitiesUpdated.class).modalities();
                modalities = newModalities == null ? Collections.emptyList() : List.copyOf(newModalities);
                break;
            default:
                throw new UnrecognizedEventTypeException(UserProfile.class.getSimpleName(), event.getType());
        }
    }

    private static String valueOrCurrent(String value, String current) {
        return value == null || value.isEmpty() ? current : value;
    }

    public String getUsername() {
        return username;
    }

    public String getEmail() {
        return email;
    }

    public String getFirstName() {
        return firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public String getFullName() {
        return firstName + " " + lastName;
    }

    public String getDateOfBirth() {
        return dateOfBirth;
    }

    public String getAvatar() {
        return avatar;
    }

    public String getBio() {
        return bio;
    }

    /**
     * @return The archetype, or {@code null} if none is assigned
     */
    public Archetype getArchetype() {
        return archetype;
    }

    public List<UserModality> getModalities() {
        return modalities;
    }
}
