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
public class BoundedNumberParameter extends NumberParameter<BoundedNumberParameter> {
    Number lowerBound, upperBound;

    public BoundedNumberParameter(String name, int decimalPlaces, Number defaultValue) {
        this(name, decimalPlaces, defaultValue, null, null);
    }

    public BoundedNumberParameter(String name, int decimalPlaces, Number defaultValue, Number lowerBound, Number upperBound) {
        super(name, decimalPlaces, defaultValue);
        this.lowerBound=lowerBound;
        this.upperBound=upperBound;
    }

    public Number getLowerBound() {
        return lowerBound;
    }

    public Number getUpperBound() {
        return upperBound;
    }
    @Override 
    public boolean isValid() {
        if (!super.isValid()) return false;
        return (lowerBound==null || value.doubleValue()>=lowerBound.doubleValue()) && (upperBound==null || value.doubleValue()<=upperBound.doubleValue());
    }
    /**
     * Values out of bounds are clipped
     */
    @Override
    public BoundedNumberParameter setValue(Number value) {
        if (value!=null) {
            if (lowerBound != null && value.doubleValue() < lowerBound.doubleValue()) value = lowerBound;
            if (upperBound != null && value.doubleValue() > upperBound.doubleValue()) value = upperBound;
        }
        return super.setValue(value);
    }
    @Override public BoundedNumberParameter duplicate() {
        BoundedNumberParameter res = new BoundedNumberParameter(name, decimalPlaces, value, lowerBound, upperBound);
        return transferStateArguments(res);
    }
}
