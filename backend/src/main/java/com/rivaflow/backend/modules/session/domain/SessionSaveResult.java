package com.rivaflow.backend.modules.session.domain;

import java.util.List;

public sealed interface SessionSaveResult permits SessionSaveResult.Saved, SessionSaveResult.Rejected {

    boolean isSaved();

    record Saved(StoredSession session) implements SessionSaveResult {
        @Override
        public boolean isSaved() {
            return true;
        }
    }

    record Rejected(List<FieldViolation> violations) implements SessionSaveResult {

        public Rejected {
            violations = List.copyOf(violations);
        }

        @Override
        public boolean isSaved() {
            return false;
        }
    }
}
