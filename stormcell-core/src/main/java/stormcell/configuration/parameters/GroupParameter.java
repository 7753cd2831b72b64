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
package stormcell.configuration.parameters;

import stormcell.utils.JSONUtils;
import stormcell.utils.Utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Named container of parameters, serialized as a JSON object keyed by child names
 * @author Jean Ollion
 */
public class GroupParameter extends ParameterImpl<GroupParameter> {
    protected List<Parameter> children;

    public GroupParameter(String name, Parameter... parameters) {
        this(name, Arrays.asList(parameters));
    }

    public GroupParameter(String name, Collection<Parameter> parameters) {
        super(name);
        this.children = new ArrayList<>(parameters);
    }

    public List<Parameter> getChildren() {
        return Collections.unmodifiableList(children);
    }

    @Override
    public boolean isValid() {
        return super.isValid() && children.stream().allMatch(Parameter::isValid);
    }

    public List<Parameter> getInvalidParameters() {
        return children.stream().filter(p -> !p.isValid()).collect(Collectors.toList());
    }

    @Override
    public GroupParameter duplicate() {
        List<Parameter> dup = children.stream().map(p -> (Parameter)p.duplicate()).collect(Collectors.toList());
        return transferStateArguments(new GroupParameter(name, dup));
    }

    @Override
    public Object toJSONEntry() {
        return JSONUtils.toJSONMap(children);
    }

    @Override
    public void initFromJSONEntry(Object jsonEntry) {
        if (jsonEntry==null) return;
        if (!(jsonEntry instanceof Map)) throw new IllegalArgumentException("Group "+name+": expected a JSON object, found: "+jsonEntry);
        JSONUtils.fromJSONMap(children, (Map)jsonEntry);
    }

    @Override
    public String toString() {
        return name+": "+ Utils.toStringList(children);
    }
}
