/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.units;

import java.time.LocalDateTime;

/**
 * A calendar date, optionally with a time of day. Fractional days are
 * allowed, in which case hour, minute and second are usually zero.
 *
 * <p>This is the native value of the {@code CD} unit.</p>
 */
public record CalendarDate(
        double year, double month, double day, double hour, double minute, double second)
        implements Quantity {

    public static CalendarDate of(double year, double month, double day) {
        return new CalendarDate(year, month, day, 0.0, 0.0, 0.0);
    }

    public static CalendarDate of(
            int year, int month, int day, int hour, int minute, double second) {
        return new CalendarDate(year, month, day, hour, minute, second);
    }

    /**
     * Spread the fractional day over hours, minutes and whole seconds. The
     * remainder below one second is dropped.
     */
    public LocalDateTime toLocalDateTime() {
        int wholeDay = (int) Math.floor(day);
        double fraction = day - wholeDay;
        double hours = fraction * 24.0 + hour;
        int h = (int) Math.floor(hours);
        double minutes = (hours - h) * 60.0 + minute;
        int m = (int) Math.floor(minutes);
        int s = (int) Math.floor((minutes - m) * 60.0 + second);
        return LocalDateTime.of((int) year, (int) month, wholeDay, 0, 0)
                .plusHours(h)
                .plusMinutes(m)
                .plusSeconds(s);
    }
}
