package stitcher.taskcenter.repository;

import stitcher.taskcenter.model.SettingKey;
import stitcher.taskcenter.model.TaskCenterSettings;

import java.util.Map;
import java.util.Optional;

/**
 * Durable key/value store for runtime tunables.
 */
public interface SettingsRepository {

    /**
     * Typed snapshot; keys missing from storage fall back to their defaults.
     */
    TaskCenterSettings load();

    /**
     * Raw stored value of one key, decoded from JSON.
     */
    Optional<Object> get(String key);

    /**
     * Upsert one key.
     */
    void set(SettingKey key, Object value);

    /**
     * Upsert several keys in one transaction.
     *
     * @param values wire key to value; unknown keys are stored as given
     */
    void setMany(Map<String, Object> values);

    /**
     * Insert defaults for keys that have no stored value yet.
     *
     * @return number of keys seeded
     */
    int seedDefaults();

    /**
     * Rewrite every known key with its default. Unknown keys are left alone.
     */
    void resetToDefault();
}
