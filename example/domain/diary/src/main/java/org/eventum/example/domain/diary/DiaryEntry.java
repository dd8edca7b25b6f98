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
import org.eventum.example.domain.diary.domainevents.DiaryEntryCreated;
import org.eventum.example.domain.diary.domainevents.DiaryEntryDeleted;
import org.eventum.example.domain.diary.domainevents.DiaryEntryUpdated;
import org.eventum.example.domain.diary.domainevents.DiaryEventType;

import java.util.Collections;
import java.util.List;

import static org.eventum.example.domain.diary.domainevents.DiaryEventType.DIARY_ENTRY_CREATED;
import static org.eventum.example.domain.diary.domainevents.DiaryEventType.DIARY_ENTRY_DELETED;
import static org.eventum.example.domain.diary.domainevents.DiaryEventType.DIARY_ENTRY_UPDATED;
import static java.util.Objects.requireNonNull;

/**
 * A diary entry written by a user. An entry is created once, may be updated any number of times and is finally deleted.
 */
public class DiaryEntry extends AbstractAggregate {
    private String userId = "";
    private String title = "";
    private String content = "";
    private int tokenCount;
    private String sessionId = "";
    private List<String> tags = Collections.emptyList();
    private boolean deleted;

    public DiaryEntry(String id) {
        super(id);
    }

    public void createEntry(String userId, String title, String content, int tokenCount, String sessionId, List<String> tags) {
        requireNonNull(userId, "User id cannot be null");
        requireNonNull(title, "Title cannot be null");
        if (!this.title.isEmpty()) {
            throw new DiaryEntryAlreadyExists(getId());
        }
        stage(newEvent(DIARY_ENTRY_CREATED.value, new DiaryEntryCreated(userId, title, content, tokenCount, sessionId, tags)));
    }

    public void updateEntry(String title, String content, int tokenCount, List<String> tags) {
        verifyActive();
        stage(newEvent(DIARY_ENTRY_UPDATED.value, new DiaryEntryUpdated(title, content, tokenCount, tags)));
    }

    public void deleteEntry(String reason) {
        verifyActive();
        stage(newEvent(DIARY_ENTRY_DELETED.value, new DiaryEntryDeleted(reason)));
    }

    private void verifyActive() {
        if (deleted) {
            throw new DiaryEntryIsDeleted(getId());
        } else if (title.isEmpty()) {
            throw new DiaryEntryDoesNotExist(getId());
        }
    }

    @Override
    protected void when(Event event) {
        DiaryEventType type = DiaryEventType.fromValue(event.getType())
                .orElseThrow(() -> new UnrecognizedEventTypeException(DiaryEntry.class.getSimpleName(), event.getType()));
        switch (type) {
            case DIARY_ENTRY_CREATED:
                DiaryEntryCreated created = payloadOf(event, DiaryEntryCreated.class);
                userId = created.userId();
                title = created.title();
                content = created.content();
                tokenCount = created.tokenCount();
                sessionId = created.sessionId();
                tags = created.tags() == null ? Collections.emptyList() : List.copyOf(created.tags());
                deleted = false;
                break;
            case DIARY_ENTRY_UPDATED:
                DiaryEntryUpdated updated = payloadOf(event, DiaryEntryUpdated.class);
                if (isNotEmpty(updated.title())) {
                    title = updated.title();
                }
                if (isNotEmpty(updated.content())) {
                    content = updated.content();
                }
                if (updated.tokenCount() > 0) {
                    tokenCount = updated.tokenCount();
                }
                if (updated.tags() != null) {
                    tags = List.copyOf(updated.tags());
                }
                break;
            case DIARY_ENTRY_DELETED:
                deleted = true;
                break;
            default:
                throw new UnrecognizedEventTypeException(DiaryEntry.class.getSimpleName(), event.getType());
        }
    }

    private static boolean isNotEmpty(String value) {
        return value != null && !value.isEmpty();
    }

    public String getUserId() {
        return userId;
    }

    public String getTitle() {
        return title;
    }

    public String getContent() {
        return content;
    }

    public int getTokenCount() {
        return tokenCount;
    }

    public String getSessionId() {
        return sessionId;
    }

    public List<String> getTags() {
        return tags;
    }

    public boolean isDeleted() {
        return deleted;
    }
}
