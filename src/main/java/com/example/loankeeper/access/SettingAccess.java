package com.example.loankeeper.access;

import com.example.loankeeper.models.Setting;
import java.util.Optional;

public interface SettingAccess {

    Optional<Setting> findByKey(String key);

    void put(Setting setting);
}
