package com.rivaflow.backend.modules.session.domain;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * In-memory edit of one training session. Owns the roll and technique ledgers, keeps the
 * roll totals consistent with the ledger in detailed mode and produces the payload handed to
 * the {@link SessionStore}.
 *
 * <p>Switching to simple mode keeps the roll ledger; it is only left out of the payload, so
 * switching back restores the rolls of this edit.</p>
 */
public class SessionDraft {

    private final UUID ownerId;
    private final UUID sessionId;
    private final Long version;

    private LocalDate sessionDate;
    private LocalTime classTime;
    private ClassType classType;
    private String gymName;
    private String location;
    private String notes;
    private Integer durationMinutes;
    private Integer intensity;

    private TrackingMode mode = TrackingMode.SIMPLE;
    private int rollCount;
    private int submissionsFor;
    private int submissionsAgainst;
    private List<PartnerRef> partners = new ArrayList<>();
    private final RollLedger rolls;
    private final TechniqueLedger techniques;

    private FightDynamics fightDynamics = FightDynamics.ZERO;
    private WearableMetrics wearable = WearableMetrics.EMPTY;

    private SessionDraft(UUID ownerId, UUID sessionId, Long version, RollLedger rolls, TechniqueLedger techniques) {
        this.ownerId = Objects.requireNonNull(ownerId, "ownerId");
        this.sessionId = sessionId;
        this.version = version;
        this.rolls = rolls;
        this.techniques = techniques;
    }

    public static SessionDraft create(UUID ownerId) {
        return new SessionDraft(ownerId, null, null, new RollLedger(), new TechniqueLedger());
    }

    public static SessionDraft edit(StoredSession stored) {
        SessionPayload payload = stored.payload();
        RollTracking tracking = payload.rollTracking();

        RollLedger rolls = new RollLedger();
        if (tracking instanceof DetailedRollTracking detailed) {
            List<RollEntry> entries = detailed.rolls().stream()
                    .map(roll -> RollEntry.restore(roll.partnerId(), roll.partnerName(), roll.durationMinutes(),
                            roll.submissionsFor(), roll.submissionsAgainst(), roll.notes()))
                    .toList();
            rolls = RollLedger.of(entries);
        }
        TechniqueLedger techniques = TechniqueLedger.of(payload.techniques().stream()
                .map(technique -> TechniqueEntry.restore(technique.movementId(), technique.movementName(),
                        technique.notes(), technique.mediaUrls()))
                .toList());

        SessionDraft draft = new SessionDraft(stored.ownerId(), stored.id(), stored.version(), rolls, techniques);
        draft.sessionDate = payload.sessionDate();
        draft.classTime = payload.classTime();
        draft.classType = payload.classType();
        draft.gymName = payload.gymName();
        draft.location = payload.location();
        draft.notes = payload.notes();
        draft.durationMinutes = payload.durationMinutes();
        draft.intensity = payload.intensity();
        draft.mode = tracking.mode();
        draft.rollCount = tracking.rollCount();
        draft.submissionsFor = tracking.submissionsFor();
        draft.submissionsAgainst = tracking.submissionsAgainst();
        if (tracking instanceof SimpleRollTracking simple) {
            draft.partners = new ArrayList<>(simple.partners());
        }
        draft.fightDynamics = payload.fightDynamics();
        draft.wearable = payload.wearable();
        return draft;
    }

    public void setMode(TrackingMode mode) {
        this.mode = Objects.requireNonNull(mode, "mode");
        recomputeAggregates();
    }

    /**
     * In detailed mode, resets the roll totals from the ledger. Simple-mode totals are user
     * input and are left alone.
     */
    public void recomputeAggregates() {
        if (mode == TrackingMode.DETAILED) {
            rollCount = rolls.size();
            submissionsFor = rolls.countSubmissions(Side.FOR);
            submissionsAgainst = rolls.countSubmissions(Side.AGAINST);
        }
    }

    public RollEntry addRoll() {
        RollEntry entry = rolls.add();
        recomputeAggregates();
        return entry;
    }

    public RollEntry removeRoll(int index) {
        RollEntry removed = rolls.removeAt(index);
        recomputeAggregates();
        return removed;
    }

    public RollEntry updateRoll(int index, RollPatch patch) {
        RollEntry updated = rolls.updateAt(index, patch);
        recomputeAggregates();
        return updated;
    }

    public boolean toggleSubmission(int index, Side side, Long movementId) {
        boolean tagged = rolls.toggleSubmission(index, side, movementId);
        recomputeAggregates();
        return tagged;
    }

    public void replaceRolls(List<RollEntry> entries) {
        rolls.replaceWith(entries);
        recomputeAggregates();
    }

    public void replaceTechniques(List<TechniqueEntry> entries) {
        techniques.replaceWith(entries);
    }

    public void setSimpleTotals(int rollCount, int submissionsFor, int submissionsAgainst) {
        if (mode == TrackingMode.DETAILED) {
            throw new IllegalStateException("Roll totals are derived from the roll ledger in detailed mode");
        }
        this.rollCount = rollCount;
        this.submissionsFor = submissionsFor;
        this.submissionsAgainst = submissionsAgainst;
    }

    public void incrementDynamics(FightDynamics.Field field) {
        fightDynamics = fightDynamics.increment(field);
    }

    public void decrementDynamics(FightDynamics.Field field) {
        fightDynamics = fightDynamics.decrement(field);
    }

    public void setDynamics(FightDynamics.Field field, int value) {
        fightDynamics = fightDynamics.set(field, value);
    }

    public SessionPayload toPayload() {
        recomputeAggregates();
        RollTracking tracking = mode == TrackingMode.DETAILED
                ? new DetailedRollTracking(rolls.toPayload())
                : new SimpleRollTracking(rollCount, submissionsFor, submissionsAgainst, partners);
        return new SessionPayload(
                sessionDate,
                classTime,
                classType,
                trimToNull(gymName),
                trimToNull(location),
                trimToNull(notes),
                durationMinutes,
                intensity,
                tracking,
                techniques.toPayload(),
                fightDynamics,
                wearable
        );
    }

    public List<FieldViolation> validate(SessionValidator validator) {
        return validator.validate(toPayload());
    }

    /**
     * Validates and, when clean, hands the payload to the store. A rejected draft never
     * reaches the store.
     */
    public SessionSaveResult save(SessionStore store, SessionValidator validator) {
        SessionPayload payload = toPayload();
        List<FieldViolation> violations = validator.validate(payload);
        if (!violations.isEmpty()) {
            return new SessionSaveResult.Rejected(violations);
        }
        return new SessionSaveResult.Saved(store.saveSession(ownerId, sessionId, version, payload));
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public UUID getOwnerId() {
        return ownerId;
    }

    public UUID getSessionId() {
        return sessionId;
    }

    public Long getVersion() {
        return version;
    }

    public LocalDate getSessionDate() {
        return sessionDate;
    }

    public void setSessionDate(LocalDate sessionDate) {
        this.sessionDate = sessionDate;
    }

    public LocalTime getClassTime() {
        return classTime;
    }

    public void setClassTime(LocalTime classTime) {
        this.classTime = classTime;
    }

    public ClassType getClassType() {
        return classType;
    }

    public void setClassType(ClassType classType) {
        this.classType = classType;
    }

    public String getGymName() {
        return gymName;
    }

    public void setGymName(String gymName) {
        this.gymName = gymName;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }

    public Integer getDurationMinutes() {
        return durationMinutes;
    }

    public void setDurationMinutes(Integer durationMinutes) {
        this.durationMinutes = durationMinutes;
    }

    public Integer getIntensity() {
        return intensity;
    }

    public void setIntensity(Integer intensity) {
        this.intensity = intensity;
    }

    public TrackingMode getMode() {
        return mode;
    }

    public int getRollCount() {
        return mode == TrackingMode.DETAILED ? rolls.size() : rollCount;
    }

    public int getSubmissionsFor() {
        return mode == TrackingMode.DETAILED ? rolls.countSubmissions(Side.FOR) : submissionsFor;
    }

    public int getSubmissionsAgainst() {
        return mode == TrackingMode.DETAILED ? rolls.countSubmissions(Side.AGAINST) : submissionsAgainst;
    }

    public List<PartnerRef> getPartners() {
        return List.copyOf(partners);
    }

    public void setPartners(List<PartnerRef> partners) {
        this.partners = partners == null ? new ArrayList<>() : new ArrayList<>(partners);
    }

    public RollLedger getRolls() {
        return rolls;
    }

    public TechniqueLedger getTechniques() {
        return techniques;
    }

    public FightDynamics getFightDynamics() {
        return fightDynamics;
    }

    public void setFightDynamics(FightDynamics fightDynamics) {
        this.fightDynamics = fightDynamics == null ? FightDynamics.ZERO : fightDynamics;
    }

    public WearableMetrics getWearable() {
        return wearable;
    }

    public void setWearable(WearableMetrics wearable) {
        this.wearable = wearable == null ? WearableMetrics.EMPTY : wearable;
    }
}
