package com.catalog.objcat.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.catalog.objcat.api.ChangeListener;
import com.catalog.objcat.api.DuplicateOwnershipException;
import com.catalog.objcat.api.EmptyFieldException;
import com.catalog.objcat.api.LookupException;
import com.catalog.objcat.api.Subscription;
import com.catalog.objcat.api.TypeConstraint;
import com.catalog.objcat.api.TypeMismatchException;
import com.catalog.objcat.engine.InvalidationPass;
import com.catalog.objcat.engine.NotifierList;
import com.catalog.objcat.source.Source;

import lombok.extern.log4j.Log4j2;

/**
 * One attribute of a {@link FieldNode}: an ordered list of values, at most one
 * per {@link Source}. The first entry is the current value.
 *
 * <p>
 * Every mutation is validated first, then announced to the registered
 * {@link ChangeListener}s when it changes the current entry, and only then
 * committed. A listener that throws therefore leaves the field unchanged.
 *
 * <p>
 * String keys name a source, or select the nth derived value with
 * {@code "derived"} / {@code "derivedN"}.
 */
@Log4j2
public class Field<T> {
    private static final Pattern DERIVED_SELECTOR = Pattern.compile("derived(\\d*)");

    private final String name;
    private final List<FieldValue<T>> values = new ArrayList<>();
    private final NotifierList notifiers = new NotifierList();
    private TypeConstraint type;
    private FieldNode node;

    public Field(String name) {
        this(name, TypeConstraint.ANY);
    }

    public Field(String name, TypeConstraint type) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = type == null ? TypeConstraint.ANY : type;
    }

    /** Creates a field whose default value is {@code defaultValue}. */
    public Field(String name, TypeConstraint type, T defaultValue) {
        this(name, type);
        setDefault(defaultValue);
    }

    public String name() {
        return name;
    }

    /** The container holding this field, or null. */
    public FieldNode node() {
        return node;
    }

    public TypeConstraint type() {
        return type;
    }

    /**
     * Switches the type constraint after checking every stored observed value
     * against it. Derived values recheck on their next computation.
     */
    public void setType(TypeConstraint newType) {
        TypeConstraint constraint = newType == null ? TypeConstraint.ANY : newType;
        for (FieldValue<T> v : values) {
            if (v instanceof ObservedValue<T> observed) {
                checkType(observed.value(), constraint);
            }
        }
        this.type = constraint;
        for (DerivedValue<T> dv : derived()) {
            dv.markStale();
        }
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    // ---- reads ----

    public FieldValue<T> get(int index) {
        checkIndex(index, values.size());
        return values.get(index);
    }

    public FieldValue<T> get(Source source) {
        int index = indexOf(source);
        if (index < 0) {
            throw new LookupException("Field " + name + " does not have " + source);
        }
        return values.get(index);
    }

    public FieldValue<T> get(String key) {
        Matcher m = DERIVED_SELECTOR.matcher(key);
        if (m.matches()) {
            return derived(m.group(1).isEmpty() ? 0 : Integer.parseInt(m.group(1)));
        }
        return get(sourceNamed(key));
    }

    /** The {@code n}th derived value, counting from 0 in field order. */
    public DerivedValue<T> derived(int n) {
        List<DerivedValue<T>> derived = derived();
        if (n < 0 || n >= derived.size()) {
            throw new LookupException("Field " + name + " has only " + derived.size() + " derived values");
        }
        return derived.get(n);
    }

    public int indexOf(Source source) {
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i).source() == source) {
                return i;
            }
        }
        return -1;
    }

    public boolean contains(Source source) {
        return indexOf(source) >= 0;
    }

    public boolean contains(String sourceName) {
        return Source.find(sourceName).map(this::contains).orElse(false);
    }

    /** The current entry. */
    public FieldValue<T> current() {
        if (values.isEmpty()) {
            throw new EmptyFieldException("Field " + name + " empty");
        }
        return values.get(0);
    }

    /** The value of the current entry. */
    public T currentValue() {
        return current().value();
    }

    public T currentValueOrNull() {
        return values.isEmpty() ? null : values.get(0).value();
    }

    boolean isCurrent(FieldValue<?> value) {
        return !values.isEmpty() && values.get(0) == value;
    }

    // ---- mutations ----

    /** Replaces the entry at {@code index} with a value of the same source. */
    public void set(int index, FieldValue<T> value) {
        checkIndex(index, values.size());
        FieldValue<T> old = values.get(index);
        validate(value, old);
        if (old.source() != value.source()) {
            throw new IllegalArgumentException("Tried to set " + value + " into the slot of " + old.source());
        }
        if (index == 0) {
            notifyValueChange(old, value);
        }
        values.set(index, value);
        adopt(value);
    }

    /** Replaces the entry of {@code source}, or appends when there is none. */
    public void set(Source source, FieldValue<T> value) {
        int index = indexOf(source);
        if (index >= 0) {
            set(index, value);
            return;
        }
        if (value.source() != source) {
            throw new IllegalArgumentException("Tried to set " + value + " under " + source);
        }
        add(value);
    }

    /** Stores a literal under {@code source}, replacing any previous entry. */
    public void put(Source source, T literal) {
        set(source, new ObservedValue<>(literal, source));
    }

    public void put(String sourceSpec, T literal) {
        put(Source.of(sourceSpec), literal);
    }

    /** Appends {@code value}; it becomes current only if the field was empty. */
    public void add(FieldValue<T> value) {
        insert(values.size(), value);
    }

    public void insert(int index, FieldValue<T> value) {
        checkIndex(index, values.size() + 1);
        validate(value, null);
        if (index == 0) {
            notifyValueChange(values.isEmpty() ? null : values.get(0), value);
        }
        values.add(index, value);
        adopt(value);
    }

    /** Inserts {@code value} just before the entry of {@code before}. */
    public void insert(Source before, FieldValue<T> value) {
        int index = indexOf(before);
        if (index < 0) {
            throw new LookupException("Field " + name + " does not have " + before);
        }
        insert(index, value);
    }

    public void delete(int index) {
        checkIndex(index, values.size());
        if (index == 0) {
            notifyValueChange(values.get(0), values.size() > 1 ? values.get(1) : null);
        }
        release(values.remove(index));
    }

    public void delete(Source source) {
        int index = indexOf(source);
        if (index < 0) {
            throw new LookupException("Field " + name + " does not have " + source);
        }
        delete(index);
    }

    public void delete(String key) {
        delete(get(key).source());
    }

    /** Makes {@code value} current by inserting it at the front. */
    public void setCurrent(FieldValue<T> value) {
        insert(0, value);
    }

    /** Moves the existing entry of {@code source} to the front. */
    public void setCurrent(Source source) {
        int index = indexOf(source);
        if (index < 0) {
            throw new LookupException("Field " + name + " does not have " + source);
        }
        if (index == 0) {
            return;
        }
        FieldValue<T> moving = values.get(index);
        notifyValueChange(values.get(0), moving);
        values.remove(index);
        values.add(0, moving);
    }

    public void setCurrent(String key) {
        setCurrent(get(key).source());
    }

    /** Removes every entry, announcing the field became empty. */
    public void clear() {
        if (values.isEmpty()) {
            return;
        }
        notifyValueChange(values.get(0), null);
        List<FieldValue<T>> removed = new ArrayList<>(values);
        values.clear();
        removed.forEach(this::release);
    }

    // ---- defaults ----

    public boolean hasDefault() {
        return contains(Source.DEFAULT);
    }

    public T defaultValue() {
        return get(Source.DEFAULT).value();
    }

    public void setDefault(T value) {
        put(Source.DEFAULT, value);
    }

    public void removeDefault() {
        delete(Source.DEFAULT);
    }

    // ---- introspection ----

    /** Unmodifiable view of the entries in order. */
    public List<FieldValue<T>> entries() {
        return Collections.unmodifiableList(values);
    }

    /** The value of every entry, computing derived ones. */
    public List<T> values() {
        List<T> out = new ArrayList<>(values.size());
        for (FieldValue<T> v : values) {
            out.add(v.value());
        }
        return out;
    }

    public List<Source> sources() {
        List<Source> out = new ArrayList<>(values.size());
        for (FieldValue<T> v : values) {
            out.add(v.source());
        }
        return out;
    }

    public List<String> sourceNames() {
        List<String> out = new ArrayList<>(values.size());
        for (FieldValue<T> v : values) {
            out.add(v.source().name());
        }
        return out;
    }

    /** Observed entries other than the default. */
    public List<ObservedValue<T>> observed() {
        List<ObservedValue<T>> out = new ArrayList<>();
        for (FieldValue<T> v : values) {
            if (v instanceof ObservedValue<T> o && o.source() != Source.DEFAULT) {
                out.add(o);
            }
        }
        return out;
    }

    public List<DerivedValue<T>> derived() {
        List<DerivedValue<T>> out = new ArrayList<>();
        for (FieldValue<T> v : values) {
            if (v instanceof DerivedValue<T> d) {
                out.add(d);
            }
        }
        return out;
    }

    public String describe() {
        return "Field " + name + ":" + values;
    }

    public String describeCurrent() {
        return values.isEmpty() ? "Field " + name + " empty" : "Field " + name + ":" + values.get(0).value();
    }

    // ---- notification ----

    public Subscription registerNotifier(ChangeListener listener) {
        return notifiers.add(listener);
    }

    public int notifierCount() {
        return notifiers.liveCount();
    }

    /** Announces a current-value change in a fresh invalidation pass. */
    public void notifyValueChange(FieldValue<?> oldValue, FieldValue<?> newValue) {
        notifyValueChange(oldValue, newValue, new InvalidationPass());
    }

    public void notifyValueChange(FieldValue<?> oldValue, FieldValue<?> newValue, InvalidationPass pass) {
        notifiers.fire(oldValue, newValue, pass);
    }

    // ---- container hooks ----

    void attachTo(FieldNode owner) {
        this.node = owner;
        for (DerivedValue<T> dv : derived()) {
            dv.setPathNode(owner);
        }
    }

    void detach() {
        notifyValueChange(currentValueOrNullEntry(), null);
        this.node = null;
        for (DerivedValue<T> dv : derived()) {
            dv.setPathNode(null);
        }
    }

    void relinkDerived() {
        for (DerivedValue<T> dv : derived()) {
            dv.relink();
        }
    }

    private FieldValue<T> currentValueOrNullEntry() {
        return values.isEmpty() ? null : values.get(0);
    }

    private void validate(FieldValue<T> value, FieldValue<T> replaced) {
        Objects.requireNonNull(value, "value");
        if (value instanceof ObservedValue<T> observed) {
            checkType(observed.value(), type);
        } else if (value instanceof DerivedValue<T> derived && !derived.canBindTo(this)) {
            throw new DuplicateOwnershipException(derived + " is already bound to field " + derived.field().name());
        }
        if (replaced == null) {
            for (FieldValue<T> existing : values) {
                if (existing.source() == value.source()) {
                    throw new DuplicateOwnershipException(
                            "Field " + name + " already has a value from " + value.source());
                }
            }
        }
    }

    private void checkType(Object value, TypeConstraint constraint) {
        if (value != null && !constraint.accepts(value)) {
            throw new TypeMismatchException("Value " + value + " is not of type " + constraint.describe()
                    + " required by field " + name);
        }
    }

    private void release(FieldValue<T> value) {
        if (value instanceof DerivedValue<T> derived) {
            derived.release();
        }
    }

    private void adopt(FieldValue<T> value) {
        if (value instanceof DerivedValue<T> derived) {
            derived.bindTo(this);
        }
    }

    private Source sourceNamed(String key) {
        return Source.find(key).orElseThrow(() -> new LookupException("Field " + name + " has no source " + key));
    }

    private void checkIndex(int index, int bound) {
        if (index < 0 || index >= bound) {
            throw new LookupException("Index " + index + " out of range for field " + name + " of size "
                    + values.size());
        }
    }

    @Override
    public String toString() {
        return describe();
    }
}
