/*
 * Copyright 2024 The MacGate Authors. All Rights Reserved
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package macgate.portal;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.*;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Portal definitions persisted as a JSON array.
 * <p/>
 * Every change is written to a temporary file and then moved over the existing file so a crash
 * never leaves a partial file behind.
 */
public class JsonPortalStore implements PortalStore {
    private static final Logger logger = LogManager.getLogger(JsonPortalStore.class);

    private static final Type PORTAL_LIST_TYPE = new TypeToken<List<Portal>>() {}.getType();

    private final Gson gson;
    private final File file;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Portal> portals = new LinkedHashMap<>();

    public JsonPortalStore(File file) {
        this.file = file;

        GsonBuilder gsonBuilder = new GsonBuilder();
        gsonBuilder.setPrettyPrinting();
        gson = gsonBuilder.create();
    }

    /**
     * Loads the portal definitions from disk. A missing file is an empty store.
     *
     * @throws IOException If the file exists but can't be read or parsed.
     */
    public void load() throws IOException {
        lock.writeLock().lock();

        try {
            portals.clear();

            if (!file.exists()) {
                logger.info("'{}' was not found. No portals are defined.", file);
                return;
            }

            List<Portal> loaded;
            try (Reader reader = new InputStreamReader(new FileInputStream(file), StandardCharsets.UTF_8)) {
                loaded = gson.fromJson(reader, PORTAL_LIST_TYPE);
            } catch (JsonParseException e) {
                throw new IOException("Unable to parse '" + file + "'", e);
            }

            if (loaded != null) {
                for (Portal portal : loaded) {
                    if (portal.getId() == null) {
                        logger.warn("Skipping portal '{}' without an id.", portal.getName());
                        continue;
                    }
                    portal.setMacs(portal.getMacs());
                    portals.put(portal.getId(), portal);
                }
            }

            logger.info("Loaded {} portal{} from '{}'.", portals.size(), portals.size() == 1 ? "" : "s", file);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<Portal> getPortals() {
        List<Portal> returnValue = new ArrayList<>();

        lock.readLock().lock();

        try {
            for (Portal portal : portals.values()) {
                returnValue.add(portal.copy());
            }
        } finally {
            lock.readLock().unlock();
        }

        return returnValue;
    }

    @Override
    public Portal getPortal(String portalId) {
        lock.readLock().lock();

        try {
            Portal portal = portals.get(portalId);
            return portal == null ? null : portal.copy();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean moveMac(String portalId, String mac) throws IOException {
        lock.writeLock().lock();

        try {
            Portal portal = portals.get(portalId);
            if (portal == null) {
                return false;
            }

            MacRecord record = portal.getMac(mac);
            if (record == null) {
                return false;
            }

            List<MacRecord> macs = portal.getMacs();
            macs.remove(record);
            macs.add(record);

            save();
            logger.info("Moved MAC {} to the end of the list for portal '{}'.", mac, portal.getName());

            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void updateMacExpiry(String portalId, String mac, String expiry) throws IOException {
        lock.writeLock().lock();

        try {
            Portal portal = portals.get(portalId);
            if (portal == null) {
                return;
            }

            MacRecord record = portal.getMac(mac);
            if (record == null) {
                return;
            }

            if (expiry == null ? record.getExpiry() == null : expiry.equals(record.getExpiry())) {
                return;
            }

            record.setExpiry(expiry);
            save();
        } finally {
            lock.writeLock().unlock();
        }
    }

    // Must be called with the write lock held.
    private void save() throws IOException {
        File parent = file.getAbsoluteFile().getParentFile();
        File tempFile = new File(parent, file.getName() + ".tmp");

        try (Writer writer = new OutputStreamWriter(new FileOutputStream(tempFile), StandardCharsets.UTF_8)) {
            gson.toJson(new ArrayList<>(portals.values()), PORTAL_LIST_TYPE, writer);
        }

        Files.move(tempFile.toPath(), file.toPath(), StandardCopyOption.REPLACE_EXISTING);
    }
}
