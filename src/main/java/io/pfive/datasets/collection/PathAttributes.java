// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.collection;

import com.google.common.collect.ImmutableMap;
import io.pfive.datasets.table.FieldType;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/// Extracts queryable attributes from the relative paths of files in a directory tree, using a
/// regular expression with one named group per attribute. For a tree of daily files laid out as
/// "2020/sst_20200131" the expression `(?<Year>\d{4})/sst_\d{4}(?<Month>\d{2})(?<Day>\d{2})` with
/// all three attributes typed INTEGER gives each file Year, Month and Day attributes to filter on.
///
/// The expression must match the whole path (with "/" separators and without the file suffix).
/// Files whose paths do not match are not members of the collection.
public class PathAttributes {

    private final Pattern pattern;
    private final Map<String, FieldType> types;

    /// @param types the type of each named group in the expression. Every key must be a group.
    public PathAttributes (String regex, Map<String, FieldType> types) {
        checkNotNull(regex, "regex");
        this.pattern = Pattern.compile(regex);
        this.types = ImmutableMap.copyOf(types);
        for (String name : this.types.keySet()) {
            checkArgument(regex.contains("(?<" + name + ">"), "Expression has no group named %s.", name);
        }
    }

    /// Returns the attributes of the path, or null if the path does not match.
    public Map<String, Object> extract (String relativePath) {
        Matcher matcher = pattern.matcher(relativePath);
        if (!matcher.matches()) return null;
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (Map.Entry<String, FieldType> entry : types.entrySet()) {
            String text = matcher.group(entry.getKey());
            attributes.put(entry.getKey(), entry.getValue().convert(text));
        }
        return attributes;
    }

    public Map<String, FieldType> types () {
        return types;
    }

    @Override
    public String toString () {
        return "PathAttributes[" + pattern + "]";
    }
}
