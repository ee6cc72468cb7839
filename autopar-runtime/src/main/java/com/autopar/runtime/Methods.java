package com.autopar.runtime;

import com.autopar.core.tree.SourcePos;

import java.util.List;

/** Method calls on runtime values: the list and string methods the analyzer knows by name. */
final class Methods {

    private Methods() {}

    static Object invoke(Object receiver, String name, List<Object> args, SourcePos pos) {
        if (receiver instanceof List<?>) {
            return onList(Values.list(receiver, pos), name, args, pos);
        }
        if (receiver instanceof String) {
            return onString((String) receiver, name, args, pos);
        }
        throw new ProgramException("No method " + name + " on " + Values.typeName(receiver), pos);
    }

    private static Object onList(List<Object> list, String name, List<Object> args, SourcePos pos) {
        switch (name) {
            case "add":
            case "append":
            case "push":
            case "offer":
                if (args.size() == 2) {
                    list.add(Values.index(args.get(0), list.size() + 1, pos), args.get(1));
                    return null;
                }
                list.add(arg(args, 0, name, pos));
                return true;
            case "size":
            case "length":
                return (long) list.size();
            case "get":
                return list.get(Values.index(arg(args, 0, name, pos), list.size(), pos));
            case "set":
            case "put":
                return list.set(Values.index(arg(args, 0, name, pos), list.size(), pos), arg(args, 1, name, pos));
            case "contains":
                return indexOf(list, arg(args, 0, name, pos)) >= 0;
            case "indexOf":
                return (long) indexOf(list, arg(args, 0, name, pos));
            case "isEmpty":
                return list.isEmpty();
            case "remove": {
                Object a = arg(args, 0, name, pos);
                if (a instanceof Long) return list.remove(Values.index(a, list.size(), pos));
                int k = indexOf(list, a);
                if (k >= 0) list.remove(k);
                return k >= 0;
            }
            case "pop":
                if (list.isEmpty()) throw new ProgramException("pop from empty list", pos);
                return list.remove(list.size() - 1);
            case "poll":
                return list.isEmpty() ? null : list.remove(0);
            case "clear":
                list.clear();
                return null;
            case "addAll":
                return list.addAll(Values.list(arg(args, 0, name, pos), pos));
            case "sort":
                list.sort((a, b) -> Values.compare(a, b, pos));
                return null;
            default:
                throw new ProgramException("No method " + name + " on list", pos);
        }
    }

    private static Object onString(String s, String name, List<Object> args, SourcePos pos) {
        switch (name) {
            case "length":
            case "size":
                return (long) s.length();
            case "charAt":
                return String.valueOf(s.charAt(Values.index(arg(args, 0, name, pos), s.length(), pos)));
            case "indexOf":
                return (long) s.indexOf(Values.display(arg(args, 0, name, pos)));
            case "contains":
                return s.contains(Values.display(arg(args, 0, name, pos)));
            case "isEmpty":
                return s.isEmpty();
            case "startsWith":
                return s.startsWith(Values.display(arg(args, 0, name, pos)));
            case "endsWith":
                return s.endsWith(Values.display(arg(args, 0, name, pos)));
            case "equals":
                return s.equals(arg(args, 0, name, pos));
            case "toUpperCase":
                return s.toUpperCase(java.util.Locale.ROOT);
            case "toLowerCase":
                return s.toLowerCase(java.util.Locale.ROOT);
            case "trim":
                return s.trim();
            case "substring": {
                int from = bound(arg(args, 0, name, pos), s.length(), pos);
                int to = args.size() > 1 ? bound(args.get(1), s.length(), pos) : s.length();
                if (from > to) throw new ProgramException("substring(" + from + ", " + to + ")", pos);
                return s.substring(from, to);
            }
            default:
                throw new ProgramException("No method " + name + " on string", pos);
        }
    }

    private static int indexOf(List<Object> list, Object value) {
        for (int k = 0; k < list.size(); k++) {
            if (Values.valueEquals(list.get(k), value)) return k;
        }
        return -1;
    }

    /** A position in {@code [0, size]}, as substring bounds allow. */
    private static int bound(Object value, int size, SourcePos pos) {
        return Values.index(value, size + 1, pos);
    }

    private static Object arg(List<Object> args, int k, String method, SourcePos pos) {
        if (k >= args.size()) {
            throw new ProgramException(method + " needs " + (k + 1) + " argument(s), got " + args.size(), pos);
        }
        return args.get(k);
    }
}
