package com.shiptivity.board.application.service;

import com.shiptivity.board.core.model.Client;

import java.util.List;

import static com.shiptivity.board.core.model.Lane.BACKLOG;
import static com.shiptivity.board.core.model.Lane.COMPLETE;
import static com.shiptivity.board.core.model.Lane.IN_PROGRESS;

/**
 * Initial board contents, densely ranked per lane.
 */
final class BoardSeed {

    private static final List<Client> CLIENTS = List.of(
            new Client(1, "Stark, White and Abbott", "Cloned Optimal Architecture", IN_PROGRESS, 1),
            new Client(2, "Wiza LLC", "Exclusive Bandwidth-Monitored Implementation", COMPLETE, 1),
            new Client(3, "Nolan LLC", "Vision-Oriented 4Thgeneration Graphicaluserinterface", BACKLOG, 1),
            new Client(4, "Thompson PLC", "Streamlined Regional Knowledgeuser", IN_PROGRESS, 2),
            new Client(5, "Walker-Williamson", "Team-Oriented 6Thgeneration Matrix", IN_PROGRESS, 3),
            new Client(6, "Boehm and Sons", "Automated Systematic Paradigm", BACKLOG, 2),
            new Client(7, "Runolfsson, Hegmann and Block", "Integrated Transitional Strategy", BACKLOG, 3),
            new Client(8, "Schumm-Labadie", "Operative Heuristic Challenge", BACKLOG, 4),
            new Client(9, "Kohler Group", "Re-Contextualized Multi-Tasking Attitude", BACKLOG, 5),
            new Client(10, "Romaguera Inc", "Managed Foreground Toolset", BACKLOG, 6),
            new Client(11, "Reilly-King", "Future-Proofed Interactive Toolset", COMPLETE, 2),
            new Client(12, "Emard, Champlin and Runolfsdottir", "Devolved Needs-Based Capability", BACKLOG, 7),
            new Client(13, "Fritsch, Cronin and Wolff", "Open-Source 3Rdgeneration Website", COMPLETE, 3),
            new Client(14, "Borer LLC", "Profit-Focused Incremental Orchestration", BACKLOG, 8),
            new Client(15, "Emmerich-Ankunding", "User-Centric Stable Extranet", IN_PROGRESS, 4),
            new Client(16, "Willms-Abbott", "Progressive Bandwidth-Monitored Access", IN_PROGRESS, 5),
            new Client(17, "Brekke PLC", "Intuitive User-Facing Customerloyalty", COMPLETE, 4),
            new Client(18, "Bins, Toy and Klocko", "Integrated Assymetric Software", BACKLOG, 9),
            new Client(19, "Hodkiewicz-Hayes", "Programmable Systematic Securedline", BACKLOG, 10),
            new Client(20, "Murphy, Lang and Ferry", "Organized Explicit Access", BACKLOG, 11)
    );

    private BoardSeed() {
    }

    static List<Client> clients() {
        return CLIENTS;
    }
}
