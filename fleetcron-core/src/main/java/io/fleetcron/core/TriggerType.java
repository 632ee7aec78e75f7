package io.fleetcron.core;

public enum TriggerType {
    INTERVAL {
        @Override
        public boolean isRepeating() {
            return true;
        }
    },
    CRON {
        @Override
        public boolean isRepeating() {
            return true;
        }
    },
    ONCE {
        @Override
        public boolean isRepeating() {
            return false;
        }
    },
    WHEN {
        @Override
        public boolean isRepeating() {
            return false;
        }
    };

    /**
     * Whether the trigger keeps producing occurrences after it fires.
     */
    public abstract boolean isRepeating();
}
