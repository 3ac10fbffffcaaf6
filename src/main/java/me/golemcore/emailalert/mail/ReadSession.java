/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.emailalert.mail;

import jakarta.mail.Folder;
import jakarta.mail.MessagingException;
import jakarta.mail.Store;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Authenticated IMAP connection with one folder opened read-only. Owned by a
 * single operation and closed when that operation ends.
 *
 * <p>
 * {@link #close()} is idempotent and never throws: a connection that already
 * died is simply marked closed.
 */
@Slf4j
public final class ReadSession implements AutoCloseable {

    private final Store store;
    private final Folder folder;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    ReadSession(Store store, Folder folder) {
        this.store = store;
        this.folder = folder;
    }

    public Folder getFolder() {
        return folder;
    }

    public String getFolderName() {
        return folder.getFullName();
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            if (folder.isOpen()) {
                folder.close(false);
            }
        } catch (MessagingException | IllegalStateException e) {
            log.debug("[IMAP] Ignoring error while closing folder: {}", e.getMessage());
        } finally {
            closeStore();
        }
    }

    private void closeStore() {
        try {
            store.close();
        } catch (MessagingException e) {
            log.debug("[IMAP] Ignoring error while closing store: {}", e.getMessage());
        }
    }
}
