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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 *
 * @author Jean Ollion
 */
public class ThreadRunner {
    public final static Logger logger = LoggerFactory.getLogger(ThreadRunner.class);

    /**
     * Runs {@param action} on each element of {@param list}.
     * @param numThreads number of threads. if lower or equal to 1 (or list has a single element) the action is run in the calling thread
     * @return errors raised by the action, localized by the element's toString
     */
    public static <T> List<Pair<String, Throwable>> execute(List<T> list, int numThreads, ThreadAction<T> action) {
        List<Pair<String, Throwable>> errors = new ArrayList<>();
        if (list==null || list.isEmpty()) return errors;
        if (numThreads<=1 || list.size()==1) {
            for (int i = 0; i<list.size(); ++i) {
                try {
                    action.run(list.get(i), i);
                } catch (Throwable t) {
                    errors.add(new Pair<>(String.valueOf(list.get(i)), t));
                }
            }
            return errors;
        }
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(numThreads, list.size()));
        try {
            CompletionService<Pair<String, Throwable>> completion = new ExecutorCompletionService<>(executor);
            for (int i = 0; i<list.size(); ++i) {
                final int idx = i;
                final T e = list.get(i);
                completion.submit(() -> {
                    try {
                        action.run(e, idx);
                    } catch (Throwable ex) {
                        return new Pair<>(String.valueOf(e), ex);
                    }
                    return null;
                });
            }
            for (int i = 0; i<list.size(); ++i) {
                try {
                    Pair<String, Throwable> e = completion.take().get();
                    if (e!=null) errors.add(e);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    errors.add(new Pair<>("interrupted", ex));
                    break;
                } catch (ExecutionException ex) {
                    errors.add(new Pair<>("execution", ex));
                }
            }
        } finally {
            executor.shutdownNow();
        }
        return errors;
    }

    /**
     * Same as {@link #execute(List, int, ThreadAction)} but throws a {@link MultipleException} if any error was raised
     */
    public static <T> void executeAndThrowErrors(List<T> list, int numThreads, ThreadAction<T> action) {
        List<Pair<String, Throwable>> errors = execute(list, numThreads, action);
        if (!errors.isEmpty()) throw new MultipleException(errors);
    }

    public interface ThreadAction<T> {
        void run(T object, int idx);
    }
}
