package com.bbthechange.mobilelogin.repository;

import com.bbthechange.mobilelogin.model.AuditEvent;
import com.bbthechange.mobilelogin.model.AuditEventKind;

public interface AuditEventRepository {

    void save(AuditEventKind kind, AuditEvent event);
}
