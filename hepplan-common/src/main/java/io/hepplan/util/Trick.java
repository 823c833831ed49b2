package io.hepplan.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

public class Trick {

    public static <T> boolean forAll(Collection<T> c, Predicate<? super T> p) {
        for (T t : c) {
            if (!p.test(t)) {
                return false;
            }
        }
        return true;
    }

    @SafeVarargs
    public static <E> List<E> concatToList(Collection<? extends E> c, E... e) {
        ArrayList<E> list = new ArrayList<>(c);
        Collections.addAll(list, e);
        return list;
    }
}
