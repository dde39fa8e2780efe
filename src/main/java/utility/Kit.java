/*
 * This file is part of the constraint generation planner CGP.
 *
 * Copyright (c) 2021. All rights reserved.
 * Christophe Lecoutre, CRIL, Univ. Artois and CNRS.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package utility;

import java.util.function.Supplier;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * A few utility fields and methods shared by all packages: the logger of the planner and control checks.
 */
public final class Kit {

	private Kit() {
	}

	/**
	 * The logger used everywhere in the planner
	 */
	public static final Logger log = Logger.getLogger("Logger CGP");

	private static final Handler handler = new ConsoleHandler();

	static {
		log.setUseParentHandlers(false);
		handler.setFormatter(new Formatter() {
			@Override
			public String format(LogRecord record) {
				Level level = record.getLevel();
				String prefix = level == Level.SEVERE ? "\n  ! ERROR " : level == Level.WARNING ? "\n  ! WARNING " : "";
				String msg = formatMessage(record);
				if (record.getThrown() != null)
					msg += " (" + record.getThrown().getClass().getSimpleName() + ": " + record.getThrown().getMessage() + ")";
				return prefix + msg + "\n";
			}
		});
		handler.setLevel(Level.ALL);
		log.addHandler(handler);
		log.setLevel(Level.CONFIG);
	}

	/**
	 * Sets the level of the logger from a verbosity value: 0 for progress messages, 1 for details on each iteration and 2 (or more) for
	 * everything
	 *
	 * @param verbose
	 *            the verbosity level
	 */
	public static void setVerbosity(int verbose) {
		log.setLevel(verbose <= 0 ? Level.CONFIG : verbose == 1 ? Level.FINE : Level.ALL);
	}

	/**
	 * Throws an IllegalStateException with the specified message if the condition is not respected
	 *
	 * @param conditionToBeRespected
	 *            a condition that must hold
	 * @param message
	 *            a supplier of the message to be used when the condition does not hold
	 */
	public static void control(boolean conditionToBeRespected, Supplier<String> message) {
		if (!conditionToBeRespected)
			throw new IllegalStateException(message.get());
	}

	public static void control(boolean conditionToBeRespected) {
		control(conditionToBeRespected, () -> "");
	}

	/**
	 * Returns a compact string for the specified double, as 12.5 or 3.0
	 */
	public static String round(double value, int nDigits) {
		double factor = Math.pow(10, nDigits);
		return String.valueOf(Math.round(value * factor) / factor);
	}
}
