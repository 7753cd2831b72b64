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

import java.util.Arrays;

/**
 *
 * @author Jean Ollion
 */
public class EnumChoiceParameter<E extends Enum<E>> extends ParameterImpl<EnumChoiceParameter<E>> {
    final E[] enumChoiceList;
    E selectedItem;

    public EnumChoiceParameter(String name, E[] enumChoiceList, E selectedItem) {
        super(name);
        this.enumChoiceList=enumChoiceList;
        this.selectedItem = selectedItem;
    }

    public E[] getEnumChoiceList() {
        return Arrays.copyOf(enumChoiceList, enumChoiceList.length);
    }

    public E getSelectedEnum() {
        return selectedItem;
    }

    public EnumChoiceParameter<E> setSelectedEnum(E selectedEnum) {
        this.selectedItem = selectedEnum;
        return this;
    }

    @Override
    public boolean isValid() {
        return selectedItem!=null && super.isValid();
    }

    @Override public EnumChoiceParameter<E> duplicate() {
        return transferStateArguments(new EnumChoiceParameter<>(name, enumChoiceList, selectedItem));
    }

    @Override
    public Object toJSONEntry() {
        return selectedItem==null ? null : selectedItem.toString();
    }

    @Override
    public void initFromJSONEntry(Object jsonEntry) {
        selectedItem = Arrays.stream(enumChoiceList).filter(e -> e.toString().equals(jsonEntry)).findAny()
                .orElseThrow(() -> new IllegalArgumentException("Parameter "+name+": unknown choice: "+jsonEntry+" among "+Arrays.toString(enumChoiceList)));
    }

    @Override
    public String toString() {
        return name+": "+selectedItem;
    }
}
