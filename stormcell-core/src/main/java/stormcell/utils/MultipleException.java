/* 
 * Copyright (C) 2025 Jean Ollion
 *
 * This File is part of STORMCELL
 *
 * STORMCELL is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * STORMCELL is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with STORMCELL.  If not, see <http://www.gnu.org/licenses/>.
 */
package stormcell.utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Errors collected from independent workers; each error is localized by the name of the worker that raised it
 * @author Jean Ollion
 */
public class MultipleException extends RuntimeException {
    private final List<Pair<String, Throwable>> exceptions = new ArrayList<>();

    public MultipleException(Collection<Pair<String, Throwable>> exceptions) {
        super();
        exceptions.stream().filter(p -> p!=null && p.key!=null && p.value!=null).forEach(this.exceptions::add);
    }

    public List<Pair<String, Throwable>> getExceptions() {
        return exceptions;
    }

    public boolean isEmpty() {
        return exceptions.isEmpty();
    }

    @Override
    public String getMessage() {
        return exceptions.size()+" error(s): "+exceptions.stream().map(p -> p.key+": "+p.value.getMessage()).collect(Collectors.joining("; "));
    }
}
