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

/**
 *
 * @author Jean Ollion
 */
public class BooleanParameter extends ParameterImpl<BooleanParameter> {
    boolean selected;

    public BooleanParameter(String name) {
        this(name, false);
    }
    
    public BooleanParameter(String name, boolean defaultValue) {
        super(name);
        this.selected = defaultValue;
    }

    public boolean getSelected() {
        return selected;
    }
    
    public BooleanParameter setSelected(boolean selected){
        this.selected = selected;
        return this;
    }
    @Override public BooleanParameter duplicate() {
        return transferStateArguments(new BooleanParameter(name, selected));
    }

    @Override
    public Object toJSONEntry() {
        return selected;
    }

    @Override
    public void initFromJSONEntry(Object jsonEntry) {
        if (jsonEntry instanceof Boolean) selected = (Boolean)jsonEntry;
        else if (jsonEntry instanceof String) selected = Boolean.parseBoolean((String)jsonEntry);
        else throw new IllegalArgumentException("Parameter "+name+": expected a boolean, found: "+jsonEntry);
    }

    @Override
    public String toString() {
        return name+": "+selected;
    }
}
