/*
 * Copyright 2024 the eppiej developers
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.eppiej.core;

import com.google.common.base.MoreObjects;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A message stored locally together with the content hash it was delivered under. Instances never change; the
 * accessors hand out copies.
 */
public final class DecMessage {
    private final String hash;
    private final Folder folder;
    private final Message message;

    public DecMessage(String hash, Folder folder, Message message) {
        this.hash = checkNotNull(hash, "hash");
        this.folder = checkNotNull(folder, "folder");
        this.message = checkNotNull(message, "message").copy();
        this.message.setFolder(folder);
    }

    public String getHash() {
        return hash;
    }

    public Folder getFolder() {
        return folder;
    }

    public Message getMessage() {
        return message.copy();
    }

    public boolean isMarkedAsRead() {
        return message.isMarkedAsRead();
    }

    public DecMessage withMarkedAsRead(boolean markedAsRead) {
        Message updated = message.copy();
        updated.setMarkedAsRead(markedAsRead);
        return new DecMessage(hash, folder, updated);
    }

    public boolean isFlagged() {
        return message.isFlagged();
    }

    public DecMessage withFlagged(boolean flagged) {
        Message updated = message.copy();
        updated.setFlagged(flagged);
        return new DecMessage(hash, folder, updated);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DecMessage other = (DecMessage) o;
        return hash.equals(other.hash) && folder == other.folder;
    }

    @Override
    public int hashCode() {
        return Objects.hash(hash, folder);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("hash", hash).add("folder", folder).add("message", message).toString();
    }
}
