/*
 * mini-cp is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License  v3
 * as published by the Free Software Foundation.
 *
 * mini-cp is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY.
 * See the GNU Lesser General Public License  for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with mini-cp. If not, see http://www.gnu.org/licenses/lgpl-3.0.en.html
 *
 * Copyright (c)  2018. by Laurent Michel, Pierre Schaus, Pascal Van Hentenryck
 */

package minicw.util.exception;

/**
 * Raised when a constraint graph breaks its own contract,
 * for instance an overlap index that falls outside a slot
 * or a binary constraint asked for two slots that do not cross.
 */
public class MalformedGraphException extends RuntimeException {

    private static final long serialVersionUID = 6420157823164598773L;

    public MalformedGraphException(String message) {
        super(message);
    }
}
